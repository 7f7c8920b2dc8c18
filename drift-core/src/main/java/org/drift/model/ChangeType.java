package org.drift.model;

public enum ChangeType {
    CREATE_TABLE,
    DROP_TABLE,
    ADD_COLUMN,
    DROP_COLUMN,
    MODIFY_COLUMN,
    ADD_CONSTRAINT,
    DROP_CONSTRAINT,
    ADD_INDEX,
    DROP_INDEX,
    MODIFY_INDEX
}
