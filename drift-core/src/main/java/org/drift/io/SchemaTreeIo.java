package org.drift.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.drift.model.ColumnMeta;
import org.drift.model.ConstraintMeta;
import org.drift.model.IndexMeta;
import org.drift.model.InvalidSchemaException;
import org.drift.model.Node;
import org.drift.model.NodeType;
import org.drift.model.SchemaTree;
import org.drift.model.TableMeta;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads and writes {@link SchemaTree} snapshots as JSON.
 *
 * <p>Reading goes through the regular node factories, so a snapshot that violates the
 * node rules fails with {@link InvalidSchemaException}; malformed JSON fails with
 * {@link IOException}.
 */
public class SchemaTreeIo {

    private final ObjectMapper objectMapper;

    public SchemaTreeIo() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public SchemaTreeIo(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SchemaTree read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public SchemaTree read(InputStream in) throws IOException {
        return toTree(objectMapper.readValue(in, NodeDocument.class));
    }

    public SchemaTree readString(String json) throws IOException {
        return toTree(objectMapper.readValue(json, NodeDocument.class));
    }

    public void write(SchemaTree tree, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, writeString(tree));
    }

    public String writeString(SchemaTree tree) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toDocument(tree.getRoot()));
    }

    private SchemaTree toTree(NodeDocument document) {
        if (document == null) {
            throw new InvalidSchemaException("Empty schema document");
        }
        return new SchemaTree(toNode(document));
    }

    private Node toNode(NodeDocument document) {
        NodeType type = nodeType(document.getType());
        Map<String, Object> meta = document.getMetadata() == null ? Map.of() : document.getMetadata();
        List<Node> children = new ArrayList<>();
        if (document.getChildren() != null) {
            for (NodeDocument child : document.getChildren()) {
                children.add(toNode(child));
            }
        }

        return switch (type) {
            case ROOT -> Node.root(children);
            case TABLE -> Node.table(document.getName(), new TableMeta(text(meta, NodeDocument.ORIGINAL_SQL)), children);
            case COLUMN -> leaf(document, children, Node.column(document.getName(), ColumnMeta.builder()
                    .type(text(meta, NodeDocument.TYPE))
                    .fullType(text(meta, NodeDocument.FULL_TYPE))
                    .constraints(text(meta, NodeDocument.CONSTRAINTS))
                    .definition(text(meta, NodeDocument.DEFINITION))
                    .referencedTable(text(meta, NodeDocument.REFERENCED_TABLE))
                    .originalSql(text(meta, NodeDocument.ORIGINAL_SQL))
                    .build()));
            case INDEX -> leaf(document, children, Node.index(document.getName(), IndexMeta.builder()
                    .table(text(meta, NodeDocument.TABLE))
                    .unique(flag(meta, NodeDocument.IS_UNIQUE))
                    .columns(text(meta, NodeDocument.COLUMNS))
                    .originalSql(text(meta, NodeDocument.ORIGINAL_SQL))
                    .build()));
            case CONSTRAINT -> leaf(document, children, Node.constraint(document.getName(),
                    new ConstraintMeta(text(meta, NodeDocument.DEFINITION))));
        };
    }

    private static Node leaf(NodeDocument document, List<Node> children, Node node) {
        if (!children.isEmpty()) {
            throw new InvalidSchemaException(String.format(
                    "%s node '%s' cannot have children", node.getType(), document.getName()));
        }
        return node;
    }

    private NodeDocument toDocument(Node node) {
        NodeDocument document = new NodeDocument();
        document.setType(node.getType().name());
        if (!node.getName().isEmpty()) {
            document.setName(node.getName());
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        switch (node.getType()) {
            case TABLE -> node.tableMeta().findOriginalSql().ifPresent(sql -> meta.put(NodeDocument.ORIGINAL_SQL, sql));
            case COLUMN -> {
                ColumnMeta column = node.columnMeta();
                meta.put(NodeDocument.TYPE, column.type());
                meta.put(NodeDocument.FULL_TYPE, column.fullType());
                putIfPresent(meta, NodeDocument.CONSTRAINTS, column.constraints());
                putIfPresent(meta, NodeDocument.DEFINITION, column.definition());
                putIfPresent(meta, NodeDocument.REFERENCED_TABLE, column.referencedTable());
                putIfPresent(meta, NodeDocument.ORIGINAL_SQL, column.originalSql());
            }
            case INDEX -> {
                IndexMeta index = node.indexMeta();
                meta.put(NodeDocument.TABLE, index.table());
                meta.put(NodeDocument.IS_UNIQUE, index.unique());
                meta.put(NodeDocument.COLUMNS, index.columns());
                putIfPresent(meta, NodeDocument.ORIGINAL_SQL, index.originalSql());
            }
            case CONSTRAINT -> meta.put(NodeDocument.DEFINITION, node.constraintMeta().definition());
            default -> {
                // ROOT: 메타데이터 없음
            }
        }
        document.setMetadata(meta);

        List<NodeDocument> children = new ArrayList<>();
        for (Node child : node.getChildren()) {
            children.add(toDocument(child));
        }
        document.setChildren(children);
        return document;
    }

    private static NodeType nodeType(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidSchemaException("Node document is missing its type");
        }
        try {
            return NodeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidSchemaException("Unknown node type: " + value, e);
        }
    }

    private static String text(Map<String, Object> meta, String key) {
        Object value = meta.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private static boolean flag(Map<String, Object> meta, String key) {
        Object value = meta.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }

    private static void putIfPresent(Map<String, Object> meta, String key, String value) {
        if (value != null && !value.isBlank()) {
            meta.put(key, value);
        }
    }
}
