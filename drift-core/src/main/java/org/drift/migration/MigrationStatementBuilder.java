package org.drift.migration;

import org.drift.migration.output.MigrationFileWriter;
import org.drift.migration.spi.TypeMapper;
import org.drift.migration.spi.dialect.Dialect;
import org.drift.model.Change;
import org.drift.model.ColumnMeta;
import org.drift.model.InvalidSchemaException;
import org.drift.model.Node;
import org.drift.model.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the forward (up) SQL statement for a single {@link Change}.
 *
 * <p>Returned statements end with {@code ;}. A {@code MODIFY_INDEX} statement holds two
 * SQL commands separated by a newline.
 */
public class MigrationStatementBuilder {

    private static final String INDENT = "  ";
    private static final String NOT_NULL = "NOT NULL";
    private static final String DEFAULT = "DEFAULT";

    private final TypeMapper typeMapper;

    public MigrationStatementBuilder(Dialect dialect) {
        this.typeMapper = Objects.requireNonNull(dialect, "dialect must not be null").typeMapper();
    }

    public String build(Change change) throws StatementGenerationException {
        try {
            return switch (change.getType()) {
                case CREATE_TABLE -> createTable(change);
                case DROP_TABLE -> "DROP TABLE IF EXISTS " + requireName(change) + ";";
                case ADD_COLUMN -> addColumn(change);
                case DROP_COLUMN -> "ALTER TABLE " + requireParent(change)
                        + " DROP COLUMN IF EXISTS " + requireName(change) + ";";
                case MODIFY_COLUMN -> modifyColumn(change);
                case ADD_CONSTRAINT -> addConstraint(change);
                case DROP_CONSTRAINT -> "ALTER TABLE " + requireParent(change)
                        + " DROP CONSTRAINT IF EXISTS " + requireName(change) + ";";
                case ADD_INDEX -> requireObject(change, NodeType.INDEX).indexMeta()
                        .definition(requireName(change)) + ";";
                case MODIFY_INDEX -> modifyIndex(change);
                case DROP_INDEX -> "DROP INDEX IF EXISTS " + requireName(change) + ";";
            };
        } catch (InvalidSchemaException e) {
            throw new StatementGenerationException(change,
                    "Invalid node for " + change.getType() + " " + change.getObjectName() + ": " + e.getMessage(), e);
        }
    }

    private String createTable(Change change) throws StatementGenerationException {
        Node table = requireObject(change, NodeType.TABLE);
        Optional<String> originalSql = table.tableMeta().findOriginalSql();
        if (originalSql.isPresent()) {
            return originalSql.get();
        }

        List<String> lines = new ArrayList<>();
        for (Node column : table.childrenOf(NodeType.COLUMN)) {
            lines.add(INDENT + columnDefinition(column));
        }
        for (Node constraint : table.childrenOf(NodeType.CONSTRAINT)) {
            lines.add(INDENT + "CONSTRAINT " + constraint.getName() + " "
                    + balanceParentheses(constraint.constraintMeta().definition().trim()));
        }

        String name = requireName(change);
        if (lines.isEmpty()) {
            return "CREATE TABLE IF NOT EXISTS " + name + " (\n);";
        }
        return "CREATE TABLE IF NOT EXISTS " + name + " (\n" + String.join(",\n", lines) + "\n);";
    }

    /**
     * Column clause inside CREATE TABLE: the stored definition, or name, dialect type and
     * constraints. Parameters of {@code fullType} are carried over onto the mapped type.
     */
    String columnDefinition(Node column) {
        ColumnMeta meta = column.columnMeta();
        Optional<String> definition = meta.findDefinition();
        if (definition.isPresent()) {
            return balanceParentheses(definition.get().trim());
        }

        String baseType = meta.baseType();
        String mapped = typeMapper.map(baseType).orElse(baseType);
        String type = meta.typeParameters().map(p -> mapped + "(" + p + ")").orElse(mapped);

        StringBuilder sb = new StringBuilder(column.getName()).append(' ').append(type);
        if (!meta.constraintsOrEmpty().isBlank()) {
            sb.append(' ').append(meta.constraintsOrEmpty().trim());
        }
        return balanceParentheses(sb.toString());
    }

    private String addColumn(Change change) throws StatementGenerationException {
        Node column = requireObject(change, NodeType.COLUMN);
        ColumnMeta meta = column.columnMeta();
        return "ALTER TABLE " + requireParent(change) + " ADD COLUMN " + meta.definition(column.getName()).trim() + ";";
    }

    /**
     * One ALTER TABLE with comma-separated column actions: TYPE, then SET/DROP NOT NULL,
     * then SET DEFAULT.
     */
    private String modifyColumn(Change change) throws StatementGenerationException {
        Node column = requireObject(change, NodeType.COLUMN);
        ColumnMeta meta = column.columnMeta();
        String alterColumn = "ALTER COLUMN " + column.getName();

        String newConstraints = change.metadata(Change.NEW_CONSTRAINTS).orElse(meta.constraintsOrEmpty());
        String oldConstraints = change.metadata(Change.OLD_CONSTRAINTS).orElse("");

        List<String> actions = new ArrayList<>();
        actions.add(alterColumn + " TYPE " + meta.fullType().trim());

        if (containsIgnoreCase(newConstraints, NOT_NULL)) {
            actions.add(alterColumn + " SET NOT NULL");
        } else if (containsIgnoreCase(oldConstraints, NOT_NULL)) {
            actions.add(alterColumn + " DROP NOT NULL");
        }

        extractDefaultValue(newConstraints)
                .ifPresent(value -> actions.add(alterColumn + " SET DEFAULT " + value));

        return "ALTER TABLE " + requireParent(change) + " " + String.join(", ", actions) + ";";
    }

    private String addConstraint(Change change) throws StatementGenerationException {
        Node constraint = requireObject(change, NodeType.CONSTRAINT);
        return "ALTER TABLE " + requireParent(change) + " ADD CONSTRAINT " + requireName(change)
                + " " + constraint.constraintMeta().definition().trim() + ";";
    }

    private String modifyIndex(Change change) throws StatementGenerationException {
        String newDefinition = change.metadata(Change.NEW_DEFINITION)
                .map(MigrationFileWriter::terminate)
                .orElseThrow(() -> new StatementGenerationException(change,
                        "MODIFY_INDEX " + change.getObjectName() + " has no " + Change.NEW_DEFINITION));
        return "DROP INDEX IF EXISTS " + requireName(change) + ";\n" + newDefinition;
    }

    /**
     * Value following the first {@code DEFAULT} keyword: a single-quoted literal including
     * its quotes, otherwise (also for an unclosed quote) the token up to the next space or comma.
     */
    static Optional<String> extractDefaultValue(String constraints) {
        if (constraints == null) {
            return Optional.empty();
        }
        int idx = constraints.toUpperCase(Locale.ROOT).indexOf(DEFAULT);
        if (idx < 0) {
            return Optional.empty();
        }
        String rest = constraints.substring(idx + DEFAULT.length()).trim();
        if (rest.isEmpty()) {
            return Optional.empty();
        }

        if (rest.startsWith("'")) {
            int end = rest.indexOf('\'', 1);
            if (end >= 0) {
                return Optional.of(rest.substring(0, end + 1));
            }
            // 닫히지 않은 따옴표는 일반 토큰처럼 처리
        }

        int end = rest.length();
        int space = rest.indexOf(' ');
        int comma = rest.indexOf(',');
        if (space >= 0) end = Math.min(end, space);
        if (comma >= 0) end = Math.min(end, comma);
        String value = rest.substring(0, end);
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Appends one {@code )} per unmatched {@code (}.
     */
    static String balanceParentheses(String sql) {
        int open = 0;
        for (int i = 0; i < sql.length(); i++) {
            char c = sql.charAt(i);
            if (c == '(') {
                open++;
            } else if (c == ')' && open > 0) {
                open--;
            }
        }
        return open == 0 ? sql : sql + ")".repeat(open);
    }

    private static boolean containsIgnoreCase(String text, String token) {
        return text != null && text.toUpperCase(Locale.ROOT).contains(token);
    }

    private static Node requireObject(Change change, NodeType expected) throws StatementGenerationException {
        Node node = change.getObject();
        if (node == null) {
            throw new StatementGenerationException(change,
                    change.getType() + " " + change.getObjectName() + " carries no node");
        }
        if (!node.is(expected)) {
            throw new StatementGenerationException(change, String.format(
                    "%s %s expects a %s node but got %s", change.getType(), change.getObjectName(), expected, node.getType()));
        }
        return node;
    }

    private static String requireName(Change change) throws StatementGenerationException {
        if (change.getObjectName().isBlank()) {
            throw new StatementGenerationException(change, change.getType() + " has no object name");
        }
        return change.getObjectName();
    }

    private static String requireParent(Change change) throws StatementGenerationException {
        if (change.getParentName().isBlank()) {
            throw new StatementGenerationException(change,
                    change.getType() + " " + change.getObjectName() + " has no owning table");
        }
        return change.getParentName();
    }
}
