package org.drift.migration.differs;

import org.drift.migration.differs.model.ConstraintTokens;
import org.drift.model.Change;
import org.drift.model.ChangeType;
import org.drift.model.Node;
import org.drift.model.NodeType;
import org.drift.model.naming.CaseNormalizer;
import org.slf4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Table-level constraints matched by name.
 *
 * <p>A constraint whose definition changed is emitted as {@code DROP_CONSTRAINT}
 * followed by {@code ADD_CONSTRAINT}; there is no in-place constraint alteration.
 */
public class ConstraintDiffer implements TableComponentDiffer {

    private final CaseNormalizer normalizer;
    private final Logger logger;

    public ConstraintDiffer(CaseNormalizer normalizer, Logger logger) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public void diff(String tableName, Node oldTable, Node newTable, List<Change> changes) {
        Map<String, Node> oldConstraints = Nodes.byName(oldTable.childrenOf(NodeType.CONSTRAINT), normalizer);
        Map<String, Node> newConstraints = Nodes.byName(newTable.childrenOf(NodeType.CONSTRAINT), normalizer);

        for (Map.Entry<String, Node> entry : newConstraints.entrySet()) {
            Node newConstraint = entry.getValue();
            Node oldConstraint = oldConstraints.get(entry.getKey());

            if (oldConstraint == null) {
                logger.debug("Found new constraint {}.{}", tableName, newConstraint.getName());
                changes.add(added(tableName, newConstraint));
            } else if (!ConstraintTokens.equivalent(
                    oldConstraint.constraintMeta().definition(),
                    newConstraint.constraintMeta().definition())) {
                logger.debug("Found modified constraint {}.{}, emitting drop + add", tableName, newConstraint.getName());
                changes.add(dropped(tableName, oldConstraint));
                changes.add(added(tableName, newConstraint).toBuilder()
                        .metadata(Map.of(
                                Change.OLD_DEFINITION, oldConstraint.constraintMeta().definition(),
                                Change.NEW_DEFINITION, newConstraint.constraintMeta().definition()))
                        .build());
            }
        }

        for (Map.Entry<String, Node> entry : oldConstraints.entrySet()) {
            if (!newConstraints.containsKey(entry.getKey())) {
                logger.debug("Found dropped constraint {}.{}", tableName, entry.getValue().getName());
                changes.add(dropped(tableName, entry.getValue()));
            }
        }
    }

    private static Change added(String tableName, Node constraint) {
        return Change.builder()
                .type(ChangeType.ADD_CONSTRAINT)
                .object(constraint)
                .objectName(constraint.getName())
                .parentName(tableName)
                .reversible(true)
                .build();
    }

    private static Change dropped(String tableName, Node constraint) {
        return Change.builder()
                .type(ChangeType.DROP_CONSTRAINT)
                .object(constraint)
                .objectName(constraint.getName())
                .parentName(tableName)
                .reversible(true)
                .build();
    }
}
