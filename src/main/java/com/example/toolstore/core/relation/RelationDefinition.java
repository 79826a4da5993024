package com.example.toolstore.core.relation;

import java.util.List;

/**
 * Concrete shape of a tool's storage table: {@code id}, {@code created_at}, then one nullable
 * column per schema field in schema order.
 */
public record RelationDefinition(String tableName, List<ColumnDefinition> columns) {

    public RelationDefinition {
        columns = List.copyOf(columns);
    }

    public List<ColumnDefinition> fieldColumns() {
        return columns.stream().filter(column -> !column.isGenerated()).toList();
    }
}
