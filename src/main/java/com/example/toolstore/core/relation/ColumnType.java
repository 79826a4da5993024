package com.example.toolstore.core.relation;

import com.example.toolstore.core.schema.FieldType;

public enum ColumnType {
    IDENTITY,
    CREATED_AT,
    INTEGER,
    STRING,
    BOOLEAN,
    JSON,
    FLOAT,
    TIMESTAMP;

    static ColumnType forField(FieldType type) {
        return switch (type) {
            case INT -> INTEGER;
            case STRING -> STRING;
            case BOOL -> BOOLEAN;
            case JSON -> JSON;
            case FLOAT -> FLOAT;
            case TIMESTAMP -> TIMESTAMP;
        };
    }
}
