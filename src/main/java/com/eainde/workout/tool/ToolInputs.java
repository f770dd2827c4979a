package com.eainde.workout.tool;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient readers for tool arguments. Models send numbers as strings and booleans
 * as "true", so every reader accepts both.
 */
public final class ToolInputs {

    public static final String WORKOUT_INDEX = "workoutIndex";

    private ToolInputs() {
    }

    public static Integer workoutIndex(JsonNode input) {
        return integer(input, WORKOUT_INDEX);
    }

    public static Integer integer(JsonNode input, String field) {
        JsonNode value = input == null ? null : input.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.intValue();
        }
        if (value.isTextual()) {
            try {
                return (int) Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static String text(JsonNode input, String field) {
        JsonNode value = input == null ? null : input.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    public static boolean bool(JsonNode input, String field, boolean defaultValue) {
        JsonNode value = input == null ? null : input.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return Boolean.parseBoolean(value.asText().trim());
    }
}
