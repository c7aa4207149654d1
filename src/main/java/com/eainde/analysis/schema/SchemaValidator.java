package com.eainde.analysis.schema;

import com.eainde.analysis.error.SchemaValidationException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks a JSON payload against the subset of JSON Schema the response contracts use:
 * {@code type} (a name or an array of names, {@code "null"} included), {@code properties},
 * {@code required}, {@code enum} and {@code items}. Other keywords are ignored.
 */
public class SchemaValidator {

    public List<SchemaViolation> validate(JsonNode schema, JsonNode value) {
        List<SchemaViolation> violations = new ArrayList<>();
        validate(schema, value, "$", violations);
        return violations;
    }

    public void requireValid(ResponseSchema schema, JsonNode value) {
        List<SchemaViolation> violations = validate(schema.definition(), value);
        if (!violations.isEmpty()) {
            throw new SchemaValidationException(schema.name(), violations);
        }
    }

    private void validate(JsonNode schema, JsonNode value, String path, List<SchemaViolation> violations) {
        if (value == null || value.isMissingNode()) {
            violations.add(new SchemaViolation(path, "missing value"));
            return;
        }
        List<String> types = types(schema);
        if (!types.isEmpty() && types.stream().noneMatch(type -> matches(type, value))) {
            violations.add(new SchemaViolation(path, "expected " + String.join(" or ", types)
                    + " but was " + value.getNodeType().name().toLowerCase(Locale.ROOT)));
            return;
        }
        if (value.isNull()) {
            return;
        }

        if (schema.has("enum") && !inEnum(schema.get("enum"), value)) {
            violations.add(new SchemaViolation(path, "value " + value + " is not one of " + schema.get("enum")));
        }

        if (value.isObject()) {
            JsonNode required = schema.get("required");
            if (required != null && required.isArray()) {
                required.forEach(name -> {
                    if (!value.has(name.asText())) {
                        violations.add(new SchemaViolation(path + "." + name.asText(), "required property is missing"));
                    }
                });
            }
            JsonNode properties = schema.get("properties");
            if (properties != null) {
                Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (value.has(field.getKey())) {
                        validate(field.getValue(), value.get(field.getKey()), path + "." + field.getKey(), violations);
                    }
                }
            }
        }

        if (value.isArray() && schema.has("items")) {
            for (int i = 0; i < value.size(); i++) {
                validate(schema.get("items"), value.get(i), path + "[" + i + "]", violations);
            }
        }
    }

    static List<String> types(JsonNode schema) {
        JsonNode type = schema.get("type");
        if (type == null) {
            return List.of();
        }
        if (type.isArray()) {
            List<String> types = new ArrayList<>();
            type.forEach(t -> types.add(t.asText()));
            return types;
        }
        return List.of(type.asText());
    }

    private static boolean matches(String type, JsonNode value) {
        return switch (type) {
            case "object" -> value.isObject();
            case "array" -> value.isArray();
            case "string" -> value.isTextual();
            case "number" -> value.isNumber();
            case "integer" -> value.isIntegralNumber()
                    || (value.isNumber() && value.asDouble() == Math.rint(value.asDouble()));
            case "boolean" -> value.isBoolean();
            case "null" -> value.isNull();
            default -> true;
        };
    }

    private static boolean inEnum(JsonNode options, JsonNode value) {
        for (JsonNode option : options) {
            if (option.equals(value)) {
                return true;
            }
        }
        return false;
    }
}
