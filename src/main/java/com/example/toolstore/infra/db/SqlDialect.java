package com.example.toolstore.infra.db;

import com.example.toolstore.core.relation.ColumnType;

import java.util.Locale;

/**
 * Engine-specific SQL fragments for per-tool tables. The engines agree on everything except
 * how a JSON column is declared and how a JSON text parameter is bound.
 */
public enum SqlDialect {
    H2("JSON", "? FORMAT JSON"),
    POSTGRESQL("JSONB", "CAST(? AS JSONB)");

    private final String jsonType;
    private final String jsonPlaceholder;

    SqlDialect(String jsonType, String jsonPlaceholder) {
        this.jsonType = jsonType;
        this.jsonPlaceholder = jsonPlaceholder;
    }

    public static SqlDialect fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported store dialect: " + name, e);
        }
    }

    public String columnDefinition(ColumnType type) {
        return switch (type) {
            case IDENTITY -> "BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
            case CREATED_AT -> "TIMESTAMP DEFAULT CURRENT_TIMESTAMP";
            case INTEGER -> "BIGINT";
            case STRING -> "VARCHAR";
            case BOOLEAN -> "BOOLEAN";
            case JSON -> jsonType;
            case FLOAT -> "DOUBLE PRECISION";
            case TIMESTAMP -> "TIMESTAMP WITH TIME ZONE";
        };
    }

    public String placeholder(ColumnType type) {
        return type == ColumnType.JSON ? jsonPlaceholder : "?";
    }

    /** Double-quotes an identifier; callers only pass names already checked by the validator. */
    public static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }
}
