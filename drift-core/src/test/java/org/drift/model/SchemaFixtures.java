package org.drift.model;

import java.util.List;

/**
 * 테스트용 스키마 노드 생성 헬퍼
 */
public final class SchemaFixtures {

    private SchemaFixtures() {
    }

    public static Node column(String name, String fullType) {
        return column(name, fullType, null);
    }

    public static Node column(String name, String fullType, String constraints) {
        return Node.column(name, ColumnMeta.builder()
                .type(baseTypeOf(fullType))
                .fullType(fullType)
                .constraints(constraints)
                .build());
    }

    public static Node foreignKey(String name, String fullType, String referencedTable) {
        return Node.column(name, ColumnMeta.builder()
                .type(baseTypeOf(fullType))
                .fullType(fullType)
                .referencedTable(referencedTable)
                .build());
    }

    public static Node table(String name, Node... children) {
        return Node.table(name, List.of(children));
    }

    public static Node index(String name, String table, boolean unique, String columns) {
        return Node.index(name, IndexMeta.builder()
                .table(table)
                .unique(unique)
                .columns(columns)
                .build());
    }

    public static Node constraint(String name, String definition) {
        return Node.constraint(name, new ConstraintMeta(definition));
    }

    public static SchemaTree schema(Node... rootChildren) {
        return SchemaTree.of(rootChildren);
    }

    private static String baseTypeOf(String fullType) {
        int paren = fullType.indexOf('(');
        return paren < 0 ? fullType : fullType.substring(0, paren);
    }
}
