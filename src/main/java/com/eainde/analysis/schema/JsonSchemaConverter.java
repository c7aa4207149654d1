package com.eainde.analysis.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts a JSON Schema document into the LangChain4j {@link JsonSchema} model.
 * <p>
 * A type array such as {@code ["number", "null"]} maps to its first non-null type: LangChain4j has no
 * nullable flag, and nullability is enforced afterwards by {@link SchemaValidator}.
 */
public class JsonSchemaConverter {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonSchemaConverter() {
    }

    public static JsonSchema toLangChainSchema(String name, String jsonSchemaString) {
        try {
            return toLangChainSchema(name, objectMapper.readTree(jsonSchemaString));
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to parse JSON Schema string", e);
        }
    }

    public static JsonSchema toLangChainSchema(String name, JsonNode rootNode) {
        return JsonSchema.builder()
                .name(name != null ? name : "Schema")
                .rootElement(parseElement(rootNode))
                .build();
    }

    private static JsonSchemaElement parseElement(JsonNode node) {
        String type = primaryType(node);
        if (type == null) {
            if (node.has("properties")) return parseObject(node);
            return JsonStringSchema.builder().description(description(node)).build();
        }

        return switch (type) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "string" -> parseString(node);
            case "integer" -> JsonIntegerSchema.builder().description(description(node)).build();
            case "number" -> JsonNumberSchema.builder().description(description(node)).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description(node)).build();
            default -> JsonStringSchema.builder().description(description(node)).build();
        };
    }

    private static String primaryType(JsonNode node) {
        for (String type : SchemaValidator.types(node)) {
            if (!"null".equals(type)) {
                return type;
            }
        }
        return null;
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        builder.description(description(node));

        if (node.has("properties")) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.get("properties").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.addProperty(field.getKey(), parseElement(field.getValue()));
            }
        }

        if (node.has("required") && node.get("required").isArray()) {
            List<String> requiredFields = new ArrayList<>();
            node.get("required").forEach(n -> requiredFields.add(n.asText()));
            builder.required(requiredFields);
        }

        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder();
        builder.description(description(node));
        if (node.has("items")) {
            builder.items(parseElement(node.get("items")));
        }
        return builder.build();
    }

    private static JsonSchemaElement parseString(JsonNode node) {
        if (node.has("enum")) {
            List<String> enumValues = new ArrayList<>();
            node.get("enum").forEach(n -> {
                if (!n.isNull()) enumValues.add(n.asText());
            });
            return JsonEnumSchema.builder()
                    .description(description(node))
                    .enumValues(enumValues)
                    .build();
        }
        return JsonStringSchema.builder().description(description(node)).build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }
}
