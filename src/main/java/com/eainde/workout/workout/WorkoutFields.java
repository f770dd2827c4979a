package com.eainde.workout.workout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Accessors for the universal workout shape. Everything here tolerates missing,
 * null and wrongly-typed nodes, because the candidate comes straight from the model.
 */
public final class WorkoutFields {

    public static final String DISCIPLINE = "discipline";
    public static final String DISCIPLINE_SPECIFIC = "discipline_specific";
    public static final String PERFORMANCE_METRICS = "performance_metrics";
    public static final String SUBJECTIVE_FEEDBACK = "subjective_feedback";
    public static final String METADATA = "metadata";
    public static final String VALIDATION_FLAGS = "validation_flags";

    /** Array fields that carry the actual work inside discipline_specific data. */
    public static final List<String> STRUCTURAL_ARRAYS =
            List.of("phases", "exercises", "rounds", "segments", "stations", "runs", "lifts");

    private WorkoutFields() {
    }

    public static String text(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /**
     * True when the field exists with a non-null, non-blank value.
     */
    public static boolean present(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return false;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isBlank();
        }
        if (value.isContainerNode()) {
            return !value.isEmpty();
        }
        return true;
    }

    public static JsonNode object(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isObject() ? value : null;
    }

    public static String discipline(JsonNode workout) {
        return text(workout, DISCIPLINE);
    }

    /**
     * The discipline-specific block for {@code discipline}, or the first non-empty block
     * when the model filed the data under a different key. Null when there is none.
     */
    public static JsonNode disciplineData(JsonNode workout, String discipline) {
        JsonNode all = object(workout, DISCIPLINE_SPECIFIC);
        if (all == null) {
            return null;
        }
        if (discipline != null) {
            JsonNode own = all.get(discipline);
            if (own != null && own.isObject() && !own.isEmpty()) {
                return own;
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = all.fields();
        while (fields.hasNext()) {
            JsonNode candidate = fields.next().getValue();
            if (candidate != null && candidate.isObject() && !candidate.isEmpty()) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * True when any structural array in the block has at least one entry.
     */
    public static boolean hasStructuralArray(JsonNode disciplineData) {
        if (disciplineData == null || !disciplineData.isObject()) {
            return false;
        }
        return STRUCTURAL_ARRAYS.stream()
                .map(disciplineData::get)
                .anyMatch(value -> value != null && value.isArray() && !value.isEmpty());
    }

    public static ObjectNode metadata(ObjectNode workout) {
        JsonNode metadata = workout.get(METADATA);
        if (metadata instanceof ObjectNode existing) {
            return existing;
        }
        return workout.putObject(METADATA);
    }

    /**
     * The metadata.validation_flags array, created (or replaced when it is not an array).
     */
    public static ArrayNode validationFlags(ObjectNode workout) {
        ObjectNode metadata = metadata(workout);
        JsonNode flags = metadata.get(VALIDATION_FLAGS);
        if (flags instanceof ArrayNode existing) {
            return existing;
        }
        return metadata.putArray(VALIDATION_FLAGS);
    }

    public static List<String> validationFlagList(ObjectNode workout) {
        List<String> flags = new ArrayList<>();
        validationFlags(workout).forEach(flag -> {
            if (flag.isTextual()) {
                flags.add(flag.asText());
            }
        });
        return flags;
    }

    public static void addFlag(ObjectNode workout, String flag) {
        ArrayNode flags = validationFlags(workout);
        for (JsonNode existing : flags) {
            if (flag.equals(existing.asText())) {
                return;
            }
        }
        flags.add(flag);
    }
}
