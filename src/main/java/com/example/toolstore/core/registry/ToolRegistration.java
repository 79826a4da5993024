package com.example.toolstore.core.registry;

import com.example.toolstore.core.schema.SchemaField;

import java.time.Instant;
import java.util.List;

public record ToolRegistration(
        String toolName,
        String token,
        List<SchemaField> schema,
        Instant createdAt
) {
    public ToolRegistration {
        schema = List.copyOf(schema);
    }

    @Override
    public String toString() {
        return "ToolRegistration[toolName=" + toolName + ", schema=" + schema
                + ", createdAt=" + createdAt + "]";
    }
}
