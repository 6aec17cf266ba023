package io.github.drompincen.folioagent.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Checks tool arguments against the subset of JSON Schema the tool catalogue uses:
 * type, required, properties, items, minItems, enum and additionalProperties=false.
 */
public final class ToolSchemaValidator {

    private ToolSchemaValidator() {}

    public static List<String> validate(JsonNode schema, JsonNode value) {
        List<String> errors = new ArrayList<>();
        validate(schema, value, "$", errors);
        return errors;
    }

    private static void validate(JsonNode schema, JsonNode value, String path, List<String> errors) {
        if (schema == null || schema.isMissingNode()) return;
        if (value == null) {
            errors.add(path + ": value is missing");
            return;
        }

        String type = schema.path("type").asText(null);
        if (type != null && !matchesType(type, value)) {
            errors.add(path + ": expected " + type + " but was " + describe(value));
            return;
        }

        JsonNode allowed = schema.get("enum");
        if (allowed != null && allowed.isArray()) {
            boolean found = false;
            for (JsonNode option : allowed) {
                if (option.equals(value)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                errors.add(path + ": value " + value + " is not one of " + allowed);
            }
        }

        if (value.isObject()) {
            JsonNode properties = schema.path("properties");
            for (JsonNode req : schema.path("required")) {
                if (!value.has(req.asText()) || value.get(req.asText()).isNull()) {
                    errors.add(path + ": missing required property '" + req.asText() + "'");
                }
            }
            boolean closed = schema.has("additionalProperties") && !schema.get("additionalProperties").asBoolean(true);
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode propSchema = properties.get(field.getKey());
                if (propSchema != null) {
                    validate(propSchema, field.getValue(), path + "." + field.getKey(), errors);
                } else if (closed) {
                    errors.add(path + ": unexpected property '" + field.getKey() + "'");
                }
            }
        }

        if (value.isArray()) {
            if (schema.has("minItems") && value.size() < schema.get("minItems").asInt()) {
                errors.add(path + ": expected at least " + schema.get("minItems").asInt() + " items");
            }
            JsonNode items = schema.get("items");
            if (items != null) {
                for (int i = 0; i < value.size(); i++) {
                    validate(items, value.get(i), path + "[" + i + "]", errors);
                }
            }
        }
    }

    private static boolean matchesType(String type, JsonNode value) {
        if (value == null) return false;
        switch (type) {
            case "object": return value.isObject();
            case "array": return value.isArray();
            case "string": return value.isTextual();
            case "integer": return value.isIntegralNumber();
            case "number": return value.isNumber();
            case "boolean": return value.isBoolean();
            case "null": return value.isNull();
            default: return true;
        }
    }

    private static String describe(JsonNode value) {
        return value == null ? "missing" : value.getNodeType().name().toLowerCase();
    }
}
