package org.drift.model;

import lombok.Builder;

import java.util.Optional;

/**
 * Index metadata.
 *
 * @param table       owning table name
 * @param unique      whether the index is UNIQUE
 * @param columns     comma-joined column list, e.g. {@code tenant_id, email}
 * @param originalSql verbatim CREATE INDEX text without trailing semicolon
 */
@Builder(toBuilder = true)
public record IndexMeta(
        String table,
        boolean unique,
        String columns,
        String originalSql
) implements NodeMetadata {

    public IndexMeta {
        if (NodeMetadata.isBlank(table)) {
            throw new InvalidSchemaException("Index metadata requires an owning table");
        }
        if (NodeMetadata.isBlank(columns)) {
            throw new InvalidSchemaException("Index metadata requires a column list");
        }
    }

    @Override
    public NodeType nodeType() {
        return NodeType.INDEX;
    }

    public Optional<String> findOriginalSql() {
        return NodeMetadata.isBlank(originalSql) ? Optional.empty() : Optional.of(originalSql);
    }

    /**
     * {@code original_sql} when present, otherwise a reconstructed
     * {@code CREATE [UNIQUE] INDEX name ON table (columns)} (no trailing semicolon).
     */
    public String definition(String indexName) {
        return findOriginalSql().orElseGet(() ->
                "CREATE " + (unique ? "UNIQUE " : "") + "INDEX " + indexName + " ON " + table + " (" + columns + ")");
    }
}
