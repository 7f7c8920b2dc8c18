package org.drift.migration;

import org.drift.model.Change;
import org.drift.model.naming.CaseNormalizer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Orders {@code CREATE_TABLE} changes so that every referenced table is created before
 * the tables referencing it (depth-first, visiting/visited marking).
 *
 * <p>References to tables outside the given set (already existing tables) and a table's
 * references to itself impose no order.
 */
public class TableDependencySorter {

    private final CaseNormalizer normalizer;

    public TableDependencySorter(CaseNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    }

    /**
     * @param tableChanges deduplicated table creations in input order
     * @param dependencies normalized table name → normalized names of the tables it references
     * @return the same changes, dependency ordered; ties keep input order
     * @throws CyclicTableDependencyException if the references form a cycle
     */
    public List<Change> sort(List<Change> tableChanges, Map<String, List<String>> dependencies) {
        Map<String, Change> byName = new LinkedHashMap<>();
        for (Change change : tableChanges) {
            byName.put(normalizer.normalize(change.getObjectName()), change);
        }

        List<Change> sorted = new ArrayList<>(byName.size());
        Set<String> visited = new HashSet<>();
        Set<String> visiting = new LinkedHashSet<>();

        for (String table : byName.keySet()) {
            visit(table, byName, dependencies, visited, visiting, sorted);
        }
        return sorted;
    }

    private void visit(String table,
                       Map<String, Change> byName,
                       Map<String, List<String>> dependencies,
                       Set<String> visited,
                       Set<String> visiting,
                       List<Change> sorted) {
        if (visited.contains(table)) {
            return;
        }
        if (visiting.contains(table)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String name : visiting) {
                inCycle = inCycle || name.equals(table);
                if (inCycle) {
                    cycle.add(name);
                }
            }
            cycle.add(table);
            throw new CyclicTableDependencyException(cycle);
        }

        visiting.add(table);
        for (String dependency : dependencies.getOrDefault(table, List.of())) {
            if (dependency.equals(table) || !byName.containsKey(dependency)) {
                continue;
            }
            visit(dependency, byName, dependencies, visited, visiting, sorted);
        }
        visiting.remove(table);
        visited.add(table);
        sorted.add(byName.get(table));
    }
}
