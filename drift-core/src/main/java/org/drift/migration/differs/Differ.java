package org.drift.migration.differs;

import org.drift.model.Change;
import org.drift.model.SchemaTree;

import java.util.List;

@FunctionalInterface
public interface Differ {
    void diff(SchemaTree oldTree, SchemaTree newTree, List<Change> changes);
}
