package org.drift.model;

public enum NodeType {
    ROOT,
    TABLE,
    COLUMN,
    INDEX,
    CONSTRAINT;

    /**
     * 부모 노드 종류별로 허용되는 자식 노드 종류
     */
    public boolean accepts(NodeType child) {
        return switch (this) {
            case ROOT -> child == TABLE || child == INDEX;
            case TABLE -> child == COLUMN || child == CONSTRAINT;
            case COLUMN, INDEX, CONSTRAINT -> false;
        };
    }
}
