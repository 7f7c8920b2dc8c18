package org.drift.model;

/**
 * @param definition constraint body without the {@code CONSTRAINT <name>} prefix,
 *                   e.g. {@code UNIQUE (email)} or {@code CHECK (price > 0)}
 */
public record ConstraintMeta(String definition) implements NodeMetadata {

    public ConstraintMeta {
        if (NodeMetadata.isBlank(definition)) {
            throw new InvalidSchemaException("Constraint metadata requires a definition");
        }
    }

    @Override
    public NodeType nodeType() {
        return NodeType.CONSTRAINT;
    }
}
