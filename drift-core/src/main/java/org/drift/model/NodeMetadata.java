package org.drift.model;

/**
 * Typed metadata attached to a {@link Node}. Each node kind has exactly one
 * implementation: {@link RootMeta}, {@link TableMeta}, {@link ColumnMeta},
 * {@link IndexMeta} and {@link ConstraintMeta}.
 */
public interface NodeMetadata {

    NodeType nodeType();

    static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
