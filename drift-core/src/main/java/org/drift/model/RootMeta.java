package org.drift.model;

public record RootMeta() implements NodeMetadata {

    public static final RootMeta INSTANCE = new RootMeta();

    @Override
    public NodeType nodeType() {
        return NodeType.ROOT;
    }
}
