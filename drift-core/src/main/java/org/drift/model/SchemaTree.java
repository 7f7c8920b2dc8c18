package org.drift.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.drift.model.naming.CaseNormalizer;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only schema snapshot owning a single {@link NodeType#ROOT} node.
 *
 * <p>Identifiers are case-insensitive, so two tables (or two indexes, or two columns of
 * one table) whose names differ only by case are rejected as a duplicate.
 */
@Getter
@EqualsAndHashCode
public final class SchemaTree {

    private static final CaseNormalizer IDENTIFIERS = CaseNormalizer.lower();

    private final Node root;

    public SchemaTree(Node root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        if (!root.is(NodeType.ROOT)) {
            throw new InvalidSchemaException("SchemaTree requires a ROOT node, got " + root.getType());
        }
        requireUniqueNames(root.childrenOf(NodeType.TABLE), "table", "schema");
        requireUniqueNames(root.childrenOf(NodeType.INDEX), "index", "schema");
        for (Node table : root.childrenOf(NodeType.TABLE)) {
            requireUniqueNames(table.childrenOf(NodeType.COLUMN), "column", table.getName());
            requireUniqueNames(table.childrenOf(NodeType.CONSTRAINT), "constraint", table.getName());
        }
    }

    public static SchemaTree of(Node... rootChildren) {
        return new SchemaTree(Node.root(List.of(rootChildren)));
    }

    public static SchemaTree empty() {
        return new SchemaTree(Node.root(List.of()));
    }

    public List<Node> tables() {
        return root.childrenOf(NodeType.TABLE);
    }

    public List<Node> indexes() {
        return root.childrenOf(NodeType.INDEX);
    }

    public Optional<Node> findTable(String name) {
        return findByName(tables(), name);
    }

    public Optional<Node> findIndex(String name) {
        return findByName(indexes(), name);
    }

    private static Optional<Node> findByName(List<Node> nodes, String name) {
        return nodes.stream().filter(n -> IDENTIFIERS.same(n.getName(), name)).findFirst();
    }

    private static void requireUniqueNames(List<Node> nodes, String kind, String scope) {
        Set<String> seen = new HashSet<>();
        for (Node node : nodes) {
            if (!seen.add(IDENTIFIERS.normalize(node.getName()))) {
                throw new InvalidSchemaException(String.format(
                        "Duplicate %s '%s' in %s", kind, node.getName(), scope));
            }
        }
    }
}
