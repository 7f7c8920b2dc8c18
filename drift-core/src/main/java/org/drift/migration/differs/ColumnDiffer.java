package org.drift.migration.differs;

import org.drift.migration.differs.model.ConstraintTokens;
import org.drift.model.Change;
import org.drift.model.ChangeType;
import org.drift.model.ColumnMeta;
import org.drift.model.InvalidSchemaException;
import org.drift.model.Node;
import org.drift.model.NodeType;
import org.drift.model.naming.CaseNormalizer;
import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Column-level comparison of a table present in both trees.
 *
 * <p>New columns become {@code ADD_COLUMN}, vanished columns {@code DROP_COLUMN}, and
 * columns failing {@link #columnsEqual(Node, Node)} become {@code MODIFY_COLUMN} carrying
 * the before/after definition, type and constraint text.
 */
public class ColumnDiffer implements TableComponentDiffer {

    private static final String VARCHAR = "varchar";

    private final CaseNormalizer normalizer;
    private final Logger logger;

    public ColumnDiffer(CaseNormalizer normalizer, Logger logger) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public void diff(String tableName, Node oldTable, Node newTable, List<Change> changes) {
        Map<String, Node> oldColumns = Nodes.byName(oldTable.childrenOf(NodeType.COLUMN), normalizer);
        Map<String, Node> newColumns = Nodes.byName(newTable.childrenOf(NodeType.COLUMN), normalizer);

        for (Map.Entry<String, Node> entry : newColumns.entrySet()) {
            Node newColumn = entry.getValue();
            Node oldColumn = oldColumns.get(entry.getKey());

            if (oldColumn == null) {
                logger.debug("Found new column {}.{}", tableName, newColumn.getName());
                changes.add(Change.builder()
                        .type(ChangeType.ADD_COLUMN)
                        .object(newColumn)
                        .objectName(newColumn.getName())
                        .parentName(tableName)
                        .reversible(true)
                        .build());
            } else if (!columnsEqual(oldColumn, newColumn)) {
                ColumnMeta before = oldColumn.columnMeta();
                ColumnMeta after = newColumn.columnMeta();
                logger.debug("Found modified column {}.{}: {} -> {}",
                        tableName, newColumn.getName(), before.fullType(), after.fullType());

                Map<String, String> metadata = new LinkedHashMap<>();
                metadata.put(Change.OLD_DEFINITION, before.definition(oldColumn.getName()));
                metadata.put(Change.NEW_DEFINITION, after.definition(newColumn.getName()));
                metadata.put(Change.OLD_TYPE, before.fullType());
                metadata.put(Change.NEW_TYPE, after.fullType());
                metadata.put(Change.OLD_CONSTRAINTS, before.constraintsOrEmpty());
                metadata.put(Change.NEW_CONSTRAINTS, after.constraintsOrEmpty());

                changes.add(Change.builder()
                        .type(ChangeType.MODIFY_COLUMN)
                        .object(newColumn)
                        .objectName(newColumn.getName())
                        .parentName(tableName)
                        .reversible(true)
                        .metadata(metadata)
                        .build());
            }
        }

        for (Map.Entry<String, Node> entry : oldColumns.entrySet()) {
            if (!newColumns.containsKey(entry.getKey())) {
                Node oldColumn = entry.getValue();
                logger.debug("Found dropped column {}.{}", tableName, oldColumn.getName());
                changes.add(Change.builder()
                        .type(ChangeType.DROP_COLUMN)
                        .object(oldColumn)
                        .objectName(oldColumn.getName())
                        .parentName(tableName)
                        .reversible(true)
                        .build());
            }
        }
    }

    /**
     * Decides whether two columns are the same for migration purposes. Checks run in
     * order and stop at the first difference:
     * <ol>
     *   <li>{@code fullType}, case-insensitive</li>
     *   <li>base type (text before {@code (}), case-insensitive</li>
     *   <li>for {@code varchar}: length present on both sides or neither, and equal when present</li>
     *   <li>constraint clauses under {@link ConstraintTokens} normalization</li>
     * </ol>
     *
     * @throws InvalidSchemaException if a node is not a column or a varchar length is not numeric
     */
    public boolean columnsEqual(Node oldColumn, Node newColumn) {
        ColumnMeta before = oldColumn.columnMeta();
        ColumnMeta after = newColumn.columnMeta();

        if (!before.fullType().trim().equalsIgnoreCase(after.fullType().trim())) {
            logger.debug("Column {} fullType mismatch: {} vs {}", newColumn.getName(), before.fullType(), after.fullType());
            return false;
        }

        if (!before.baseType().equalsIgnoreCase(after.baseType())) {
            logger.debug("Column {} base type mismatch: {} vs {}", newColumn.getName(), before.baseType(), after.baseType());
            return false;
        }

        if (VARCHAR.equalsIgnoreCase(before.baseType())) {
            Optional<Integer> oldLength = varcharLength(oldColumn);
            Optional<Integer> newLength = varcharLength(newColumn);
            if (oldLength.isPresent() != newLength.isPresent()) {
                logger.debug("Column {} varchar length presence mismatch", newColumn.getName());
                return false;
            }
            if (oldLength.isPresent() && !oldLength.get().equals(newLength.get())) {
                logger.debug("Column {} varchar length mismatch: {} vs {}", newColumn.getName(), oldLength.get(), newLength.get());
                return false;
            }
        }

        if (!ConstraintTokens.equivalent(before.constraints(), after.constraints())) {
            logger.debug("Column {} constraints mismatch: '{}' vs '{}'",
                    newColumn.getName(), before.constraintsOrEmpty(), after.constraintsOrEmpty());
            return false;
        }

        return true;
    }

    private static Optional<Integer> varcharLength(Node column) {
        Optional<String> params = column.columnMeta().typeParameters();
        if (params.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(params.get()));
        } catch (NumberFormatException e) {
            throw new InvalidSchemaException(String.format(
                    "Column '%s' has a non-numeric varchar length: %s", column.getName(), column.columnMeta().fullType()), e);
        }
    }
}
