package org.drift.model;

import lombok.Builder;

import java.util.Optional;

/**
 * Column metadata.
 *
 * @param type            base type as written, e.g. {@code varchar}
 * @param fullType        type with parameters, e.g. {@code varchar(255)}
 * @param constraints     raw constraint clause, e.g. {@code NOT NULL UNIQUE DEFAULT 'x'}
 * @param definition      full {@code name type constraints} text, used verbatim when present
 * @param referencedTable foreign-key target table; drives CREATE TABLE ordering
 * @param originalSql     verbatim source text, if the parser kept it
 */
@Builder(toBuilder = true)
public record ColumnMeta(
        String type,
        String fullType,
        String constraints,
        String definition,
        String referencedTable,
        String originalSql
) implements NodeMetadata {

    public ColumnMeta {
        if (NodeMetadata.isBlank(type)) {
            throw new InvalidSchemaException("Column metadata requires a type");
        }
        if (NodeMetadata.isBlank(fullType)) {
            throw new InvalidSchemaException("Column metadata requires a fullType");
        }
    }

    @Override
    public NodeType nodeType() {
        return NodeType.COLUMN;
    }

    /**
     * {@code type} up to the first {@code (}, trimmed.
     */
    public String baseType() {
        int paren = type.indexOf('(');
        return (paren < 0 ? type : type.substring(0, paren)).trim();
    }

    /**
     * Text between the first {@code (} and the following {@code )} of {@code fullType}.
     * An unclosed parameter list runs to the end of the string.
     */
    public Optional<String> typeParameters() {
        int open = fullType.indexOf('(');
        if (open < 0) {
            return Optional.empty();
        }
        int close = fullType.indexOf(')', open);
        String params = close < 0 ? fullType.substring(open + 1) : fullType.substring(open + 1, close);
        return params.isBlank() ? Optional.empty() : Optional.of(params.trim());
    }

    public String constraintsOrEmpty() {
        return constraints == null ? "" : constraints;
    }

    public Optional<String> findDefinition() {
        return NodeMetadata.isBlank(definition) ? Optional.empty() : Optional.of(definition);
    }

    /**
     * {@code definition} when present, otherwise {@code name fullType [constraints]}.
     */
    public String definition(String columnName) {
        return findDefinition().orElseGet(() -> {
            String base = columnName + " " + fullType;
            return constraintsOrEmpty().isBlank() ? base : base + " " + constraints.trim();
        });
    }

    public Optional<String> findReferencedTable() {
        return NodeMetadata.isBlank(referencedTable) ? Optional.empty() : Optional.of(referencedTable.trim());
    }

    public Optional<String> findOriginalSql() {
        return NodeMetadata.isBlank(originalSql) ? Optional.empty() : Optional.of(originalSql);
    }
}
