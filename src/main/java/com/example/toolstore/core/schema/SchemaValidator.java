package com.example.toolstore.core.schema;

import com.example.toolstore.core.error.SchemaException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a proposed field list for structure, type vocabulary and usable column names. Fails
 * on the first violation; there is no partial-validity report.
 */
@Component
public class SchemaValidator {

    static final int MAX_FIELD_NAME_LENGTH = 63;
    static final int MAX_TOOL_NAME_LENGTH = 50;

    private static final Pattern FIELD_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern TOOL_NAME = Pattern.compile("[A-Za-z0-9_]+");
    private static final Set<String> RESERVED = Set.of("id", "created_at");

    public List<SchemaField> validate(JsonNode schema) {
        if (schema == null || !schema.isArray()) {
            throw new SchemaException("Schema must be a list of fields");
        }
        List<SchemaField> fields = new ArrayList<>(schema.size());
        Set<String> seen = new HashSet<>();
        for (JsonNode field : schema) {
            if (!field.isObject() || !hasExactlyNameAndType(field)) {
                throw new SchemaException("Each field must have exactly 'name' and 'type'");
            }
            JsonNode name = field.get("name");
            JsonNode type = field.get("type");
            if (!name.isTextual() || !type.isTextual()) {
                throw new SchemaException("Field 'name' and 'type' must be strings");
            }
            String fieldName = name.asText();
            checkFieldName(fieldName);
            if (!seen.add(fieldName.toLowerCase(Locale.ROOT))) {
                throw new SchemaException("Duplicate field name: " + fieldName);
            }
            String tag = type.asText().toLowerCase(Locale.ROOT);
            if (FieldType.fromTag(tag).isEmpty()) {
                throw new SchemaException(
                        "Unsupported type: " + tag + ". Allowed: " + FieldType.allowedTags());
            }
            fields.add(new SchemaField(fieldName, tag));
        }
        return List.copyOf(fields);
    }

    public void validateToolName(String toolName) {
        if (toolName == null
                || toolName.length() > MAX_TOOL_NAME_LENGTH
                || !TOOL_NAME.matcher(toolName).matches()) {
            throw new SchemaException(
                    "Invalid tool name: must be 1-" + MAX_TOOL_NAME_LENGTH
                            + " characters of letters, digits or '_'");
        }
    }

    private static boolean hasExactlyNameAndType(JsonNode field) {
        if (field.size() != 2) {
            return false;
        }
        Iterator<String> names = field.fieldNames();
        Set<String> keys = new HashSet<>();
        names.forEachRemaining(keys::add);
        return keys.contains("name") && keys.contains("type");
    }

    private static void checkFieldName(String fieldName) {
        if (fieldName.length() > MAX_FIELD_NAME_LENGTH
                || !FIELD_NAME.matcher(fieldName).matches()) {
            throw new SchemaException("Invalid field name: " + fieldName);
        }
        if (RESERVED.contains(fieldName.toLowerCase(Locale.ROOT))) {
            throw new SchemaException("Field name is reserved: " + fieldName);
        }
    }
}
