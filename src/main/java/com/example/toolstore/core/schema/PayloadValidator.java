package com.example.toolstore.core.schema;

import com.example.toolstore.core.error.PayloadValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Only {@code int}, {@code str} and {@code bool} fields are type-checked; the other tags pass
 * through to the engine.
 */
@Component
public class PayloadValidator {

    public void validate(JsonNode payload, List<SchemaField> schema) {
        if (payload == null || !payload.isObject()) {
            throw new PayloadValidationException("Payload must be a JSON object");
        }
        Map<String, FieldType> types = new HashMap<>();
        for (SchemaField field : schema) {
            field.fieldType().ifPresent(type -> types.put(field.name(), type));
        }
        Iterator<Map.Entry<String, JsonNode>> entries = payload.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            FieldType expected = types.get(entry.getKey());
            if (expected == FieldType.INT && entry.getValue().isIntegralNumber()
                    && !entry.getValue().canConvertToLong()) {
                throw new PayloadValidationException(
                        "Field '" + entry.getKey() + "' holds an int outside the 64-bit range");
            }
            if (expected != null && !matches(expected, entry.getValue())) {
                throw new PayloadValidationException(
                        "Field '" + entry.getKey() + "' expected " + expected.displayTag()
                                + ", got " + describe(entry.getValue()));
            }
        }
    }

    // schema order, unknown keys dropped
    public ObjectNode retainKnownFields(JsonNode payload, List<SchemaField> schema) {
        ObjectNode retained = JsonNodeFactory.instance.objectNode();
        for (SchemaField field : schema) {
            if (payload.has(field.name())) {
                retained.set(field.name(), payload.get(field.name()));
            }
        }
        return retained;
    }

    // BooleanNode is neither numeric nor textual, so true/false never satisfies int or str.
    private static boolean matches(FieldType expected, JsonNode value) {
        return switch (expected) {
            case BOOL -> value.isBoolean();
            case INT -> value.isIntegralNumber() && value.canConvertToLong();
            case STRING -> value.isTextual();
            case JSON, FLOAT, TIMESTAMP -> true;
        };
    }

    private static String describe(JsonNode value) {
        if (value.isIntegralNumber()) {
            return "int";
        }
        if (value.isNumber()) {
            return "float";
        }
        if (value.isTextual()) {
            return "str";
        }
        return value.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
