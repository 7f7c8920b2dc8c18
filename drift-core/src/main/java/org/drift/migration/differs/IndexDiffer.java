package org.drift.migration.differs;

import org.drift.migration.differs.model.NormalizedIndex;
import org.drift.model.Change;
import org.drift.model.ChangeType;
import org.drift.model.IndexMeta;
import org.drift.model.Node;
import org.drift.model.SchemaTree;
import org.drift.model.naming.CaseNormalizer;
import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root-level index comparison, matched by name.
 *
 * <p>Structural equality is decided by {@link NormalizedIndex}; an index whose structure
 * changed becomes {@code MODIFY_INDEX} carrying both definitions, which the generator
 * turns into a drop and re-create.
 */
public class IndexDiffer implements Differ {

    private final CaseNormalizer normalizer;
    private final Logger logger;

    public IndexDiffer(CaseNormalizer normalizer, Logger logger) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public void diff(SchemaTree oldTree, SchemaTree newTree, List<Change> changes) {
        Map<String, Node> oldIndexes = Nodes.byName(oldTree.indexes(), normalizer);
        Map<String, Node> newIndexes = Nodes.byName(newTree.indexes(), normalizer);

        for (Map.Entry<String, Node> entry : newIndexes.entrySet()) {
            Node newIndex = entry.getValue();
            Node oldIndex = oldIndexes.get(entry.getKey());
            String tableName = newIndex.indexMeta().table();

            if (oldIndex == null) {
                logger.debug("Found new index {} on {}", newIndex.getName(), tableName);
                changes.add(Change.builder()
                        .type(ChangeType.ADD_INDEX)
                        .object(newIndex)
                        .objectName(newIndex.getName())
                        .parentName(tableName)
                        .reversible(true)
                        .build());
            } else if (!indexesEqual(oldIndex, newIndex)) {
                logger.debug("Found modified index {} on {}", newIndex.getName(), tableName);
                Map<String, String> metadata = new LinkedHashMap<>();
                metadata.put(Change.OLD_DEFINITION, oldIndex.indexMeta().definition(oldIndex.getName()));
                metadata.put(Change.NEW_DEFINITION, newIndex.indexMeta().definition(newIndex.getName()));

                changes.add(Change.builder()
                        .type(ChangeType.MODIFY_INDEX)
                        .object(newIndex)
                        .objectName(newIndex.getName())
                        .parentName(tableName)
                        .reversible(true)
                        .metadata(metadata)
                        .build());
            }
        }

        for (Map.Entry<String, Node> entry : oldIndexes.entrySet()) {
            if (!newIndexes.containsKey(entry.getKey())) {
                Node oldIndex = entry.getValue();
                IndexMeta meta = oldIndex.indexMeta();
                logger.debug("Found dropped index {} on {}", oldIndex.getName(), meta.table());
                changes.add(Change.builder()
                        .type(ChangeType.DROP_INDEX)
                        .object(oldIndex)
                        .objectName(oldIndex.getName())
                        .parentName(meta.table())
                        .reversible(true)
                        .build());
            }
        }
    }

    public boolean indexesEqual(Node oldIndex, Node newIndex) {
        return NormalizedIndex.of(oldIndex).equalTo(NormalizedIndex.of(newIndex));
    }
}
