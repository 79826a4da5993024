package com.example.toolstore.core.relation;

public record ColumnDefinition(String name, ColumnType type, boolean nullable) {

    public boolean isGenerated() {
        return type == ColumnType.IDENTITY || type == ColumnType.CREATED_AT;
    }
}
