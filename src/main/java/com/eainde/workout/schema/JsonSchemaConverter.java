package com.eainde.workout.schema;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts JSON Schema documents (as Jackson trees) into LangChain4j schema elements
 * so they can be used as tool parameters.
 *
 * <p>Union types such as {@code ["number", "null"]} collapse to their first non-null member:
 * tool parameters cannot express nullability, and the extraction prompt already tells the
 * model to omit unknown values.</p>
 */
public final class JsonSchemaConverter {

    private JsonSchemaConverter() {
    }

    public static JsonObjectSchema toObjectSchema(JsonNode node) {
        JsonSchemaElement element = parseElement(node);
        if (!(element instanceof JsonObjectSchema)) {
            throw new IllegalArgumentException("Schema root must be an object but was " + resolveType(node));
        }
        return (JsonObjectSchema) element;
    }

    public static JsonSchemaElement parseElement(JsonNode node) {
        String type = resolveType(node);
        if (type == null) {
            // No type: treat as object when it declares properties
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

    private static String resolveType(JsonNode node) {
        JsonNode type = node.get("type");
        if (type == null || type.isNull()) {
            return null;
        }
        if (type.isArray()) {
            for (JsonNode member : type) {
                if (!"null".equals(member.asText())) {
                    return member.asText();
                }
            }
            return null;
        }
        return type.asText();
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        if (node.has("description")) {
            builder.description(node.get("description").asText());
        }

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
        if (node.has("description")) builder.description(node.get("description").asText());
        builder.items(node.has("items")
                ? parseElement(node.get("items"))
                : JsonStringSchema.builder().build());
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
        return JsonStringSchema.builder()
                .description(description(node))
                .build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }
}
