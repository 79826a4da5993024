package com.example.toolstore.core.schema;

import java.util.Locale;
import java.util.Optional;

public record SchemaField(String name, String type) {

    public SchemaField {
        type = type == null ? null : type.toLowerCase(Locale.ROOT);
    }

    public Optional<FieldType> fieldType() {
        return FieldType.fromTag(type);
    }
}
