package org.drift.migration.differs;

import org.drift.model.Change;
import org.drift.model.ChangeType;
import org.drift.model.Node;
import org.drift.model.SchemaTree;
import org.drift.model.naming.CaseNormalizer;
import org.slf4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public class TableDiffer implements Differ {
    private final CaseNormalizer normalizer;
    private final Logger logger;
    private final List<TableComponentDiffer> componentDiffers;

    public TableDiffer(CaseNormalizer normalizer, Logger logger) {
        this(normalizer, logger, List.of(
                new ColumnDiffer(normalizer, logger),
                new ConstraintDiffer(normalizer, logger)
        ));
    }

    public TableDiffer(CaseNormalizer normalizer, Logger logger, List<TableComponentDiffer> componentDiffers) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
        this.componentDiffers = List.copyOf(Objects.requireNonNull(componentDiffers, "componentDiffers must not be null"));
    }

    @Override
    public void diff(SchemaTree oldTree, SchemaTree newTree, List<Change> changes) {
        Map<String, Node> oldTables = Nodes.byName(oldTree.tables(), normalizer);
        Map<String, Node> newTables = Nodes.byName(newTree.tables(), normalizer);

        // 1) 신규 테이블 생성 / 양쪽에 있는 테이블은 내용 비교
        for (Map.Entry<String, Node> entry : newTables.entrySet()) {
            Node newTable = entry.getValue();
            Node oldTable = oldTables.get(entry.getKey());

            if (oldTable == null) {
                logger.debug("Found new table {}", newTable.getName());
                changes.add(Change.builder()
                        .type(ChangeType.CREATE_TABLE)
                        .object(newTable)
                        .objectName(newTable.getName())
                        .reversible(true)
                        .build());
                continue;
            }

            for (TableComponentDiffer differ : componentDiffers) {
                differ.diff(newTable.getName(), oldTable, newTable, changes);
            }
        }

        // 2) 새 스키마에 없는 테이블은 드롭
        for (Map.Entry<String, Node> entry : oldTables.entrySet()) {
            if (!newTables.containsKey(entry.getKey())) {
                Node oldTable = entry.getValue();
                logger.debug("Found dropped table {}", oldTable.getName());
                changes.add(Change.builder()
                        .type(ChangeType.DROP_TABLE)
                        .object(oldTable)
                        .objectName(oldTable.getName())
                        .reversible(true)
                        .build());
            }
        }
    }
}
