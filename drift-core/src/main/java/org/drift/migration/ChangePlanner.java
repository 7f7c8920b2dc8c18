package org.drift.migration;

import org.drift.model.Change;
import org.drift.model.ChangeType;
import org.drift.model.Node;
import org.drift.model.NodeType;
import org.drift.model.naming.CaseNormalizer;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the analyzer's change list into execution order:
 * <ol>
 *   <li>deduplicate {@code CREATE_TABLE} by table name and collect foreign-key dependencies</li>
 *   <li>deduplicate the remaining changes by (type, table, object)</li>
 *   <li>dependency-sort the table creations and append the rest in input order</li>
 * </ol>
 * A dependency cycle is not fatal: it is logged and table creations keep input order.
 */
public class ChangePlanner {

    private final CaseNormalizer normalizer;
    private final TableDependencySorter sorter;
    private final Logger logger;

    public ChangePlanner(CaseNormalizer normalizer, Logger logger) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
        this.sorter = new TableDependencySorter(normalizer);
    }

    public List<Change> plan(List<Change> changes) {
        Map<String, Change> tableChanges = new LinkedHashMap<>();
        Map<String, List<String>> tableDependencies = new LinkedHashMap<>();
        Map<String, Change> otherChanges = new LinkedHashMap<>();

        // 1) CREATE TABLE 먼저: 중복 제거 + FK 의존성 수집
        for (Change change : changes) {
            if (change.getType() != ChangeType.CREATE_TABLE) {
                continue;
            }
            String table = normalizer.normalize(change.getObjectName());
            if (tableChanges.putIfAbsent(table, change) != null) {
                logger.debug("Skipping duplicate CREATE TABLE for {}", change.getObjectName());
                continue;
            }
            tableDependencies.put(table, referencedTables(change));
        }

        // 2) 나머지 변경: (type, parent, object) 기준 중복 제거
        for (Change change : changes) {
            if (change.getType() == ChangeType.CREATE_TABLE) {
                continue;
            }
            String key = change.getType() + "|" + normalizer.normalize(change.getParentName())
                    + "|" + normalizer.normalize(change.getObjectName());
            if (otherChanges.putIfAbsent(key, change) != null) {
                logger.debug("Skipping duplicate {} for {}", change.getType(), change.getObjectName());
            }
        }

        // 3) 테이블 생성 순서 정렬 (사이클이면 입력 순서 유지)
        List<Change> orderedTables;
        try {
            orderedTables = sorter.sort(new ArrayList<>(tableChanges.values()), tableDependencies);
        } catch (CyclicTableDependencyException e) {
            logger.warn("{}; keeping input order for table creation", e.getMessage());
            orderedTables = new ArrayList<>(tableChanges.values());
        }

        List<Change> planned = new ArrayList<>(orderedTables.size() + otherChanges.size());
        planned.addAll(orderedTables);
        planned.addAll(otherChanges.values());
        return planned;
    }

    private List<String> referencedTables(Change change) {
        Node table = change.getObject();
        if (table == null || !table.is(NodeType.TABLE)) {
            return List.of();
        }
        List<String> references = new ArrayList<>();
        for (Node column : table.childrenOf(NodeType.COLUMN)) {
            column.columnMeta().findReferencedTable()
                    .map(normalizer::normalize)
                    .filter(ref -> !references.contains(ref))
                    .ifPresent(references::add);
        }
        return references;
    }
}
