package org.drift.migration.differs;

import org.drift.model.Change;
import org.drift.model.Node;

import java.util.List;

/**
 * Compares the children of one table present in both trees.
 */
@FunctionalInterface
public interface TableComponentDiffer {
    void diff(String tableName, Node oldTable, Node newTable, List<Change> changes);
}
