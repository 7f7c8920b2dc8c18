package org.drift.model;

import java.util.Optional;

/**
 * @param originalSql verbatim CREATE TABLE text; preferred over reconstruction when present
 */
public record TableMeta(String originalSql) implements NodeMetadata {

    public static final TableMeta EMPTY = new TableMeta(null);

    @Override
    public NodeType nodeType() {
        return NodeType.TABLE;
    }

    public Optional<String> findOriginalSql() {
        return NodeMetadata.isBlank(originalSql) ? Optional.empty() : Optional.of(originalSql);
    }
}
