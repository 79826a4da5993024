package com.example.toolstore.core.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum FieldType {
    INT("int", "integer"),
    STRING("str", "string"),
    BOOL("bool", "boolean"),
    JSON("json"),
    FLOAT("float"),
    TIMESTAMP("timestamp");

    private static final List<String> ALLOWED_TAGS;

    static {
        List<String> tags = new ArrayList<>();
        for (FieldType type : values()) {
            tags.addAll(type.tags);
        }
        ALLOWED_TAGS = Collections.unmodifiableList(tags);
    }

    private final List<String> tags;

    FieldType(String... tags) {
        this.tags = List.of(tags);
    }

    public String displayTag() {
        return tags.get(0);
    }

    public static Optional<FieldType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String folded = tag.toLowerCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.tags.contains(folded)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static List<String> allowedTags() {
        return ALLOWED_TAGS;
    }
}
