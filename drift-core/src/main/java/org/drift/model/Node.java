package org.drift.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Objects;

/**
 * One schema object in a {@link SchemaTree}.
 *
 * <p>Nodes are immutable and validated on construction: the metadata type must match
 * the node kind, every non-root node must be named, and children must be of a kind
 * the parent accepts ({@link NodeType#accepts(NodeType)}). Construction failures throw
 * {@link InvalidSchemaException} so malformed input is rejected before any comparison runs.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "children")
public final class Node {

    private final NodeType type;
    private final String name;
    private final List<Node> children;
    private final NodeMetadata metadata;

    private Node(NodeType type, String name, List<Node> children, NodeMetadata metadata) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));

        if (type != NodeType.ROOT && NodeMetadata.isBlank(name)) {
            throw new InvalidSchemaException(type + " node requires a name");
        }
        this.name = name == null ? "" : name.trim();

        if (metadata.nodeType() != type) {
            throw new InvalidSchemaException(String.format(
                    "%s node '%s' carries %s metadata", type, this.name, metadata.nodeType()));
        }
        for (Node child : this.children) {
            if (!type.accepts(child.getType())) {
                throw new InvalidSchemaException(String.format(
                        "%s node '%s' cannot own %s node '%s'", type, this.name, child.getType(), child.getName()));
            }
        }
    }

    public static Node root(List<Node> children) {
        return new Node(NodeType.ROOT, "", children, RootMeta.INSTANCE);
    }

    public static Node table(String name, List<Node> children) {
        return table(name, TableMeta.EMPTY, children);
    }

    public static Node table(String name, TableMeta meta, List<Node> children) {
        return new Node(NodeType.TABLE, name, children, meta);
    }

    public static Node column(String name, ColumnMeta meta) {
        return new Node(NodeType.COLUMN, name, List.of(), meta);
    }

    public static Node index(String name, IndexMeta meta) {
        return new Node(NodeType.INDEX, name, List.of(), meta);
    }

    public static Node constraint(String name, ConstraintMeta meta) {
        return new Node(NodeType.CONSTRAINT, name, List.of(), meta);
    }

    public boolean is(NodeType nodeType) {
        return type == nodeType;
    }

    public List<Node> childrenOf(NodeType nodeType) {
        return children.stream().filter(c -> c.is(nodeType)).toList();
    }

    public TableMeta tableMeta() {
        return metadataAs(TableMeta.class);
    }

    public ColumnMeta columnMeta() {
        return metadataAs(ColumnMeta.class);
    }

    public IndexMeta indexMeta() {
        return metadataAs(IndexMeta.class);
    }

    public ConstraintMeta constraintMeta() {
        return metadataAs(ConstraintMeta.class);
    }

    private <T extends NodeMetadata> T metadataAs(Class<T> expected) {
        if (!expected.isInstance(metadata)) {
            throw new InvalidSchemaException(String.format(
                    "%s node '%s' has no %s", type, name, expected.getSimpleName()));
        }
        return expected.cast(metadata);
    }
}
