package com.eainde.workout.workout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static com.eainde.workout.workout.WorkoutFields.DISCIPLINE_SPECIFIC;
import static com.eainde.workout.workout.WorkoutFields.METADATA;
import static com.eainde.workout.workout.WorkoutFields.PERFORMANCE_METRICS;
import static com.eainde.workout.workout.WorkoutFields.object;

/**
 * Decides whether a validated workout needs the normalization pass.
 */
public final class NormalizationDecider {

    public static final String SCHEMA_MISMATCH_FLAG = "schema_mismatch";

    private NormalizationDecider() {
    }

    /**
     * Result of comparing the discipline block against the array fields its schema expects.
     *
     * @param valid           false when the block is missing or holds its work in the wrong arrays
     * @param forceNormalize  true when the data exists but sits under unexpected array names
     */
    public record SchemaCheck(boolean valid, boolean forceNormalize, String detail) {
    }

    public static SchemaCheck checkSchemaStructure(ObjectNode workout, List<String> expectedArrayFields) {
        JsonNode data = WorkoutFields.disciplineData(workout, WorkoutFields.discipline(workout));
        if (data == null) {
            return new SchemaCheck(false, false, "No discipline-specific data");
        }

        boolean expectedHasData = expectedArrayFields.stream()
                .map(data::get)
                .anyMatch(value -> value != null && value.isArray() && !value.isEmpty());
        if (expectedHasData || expectedArrayFields.isEmpty()) {
            return new SchemaCheck(true, false, "Expected arrays populated");
        }

        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isArray() && !field.getValue().isEmpty()) {
                return new SchemaCheck(false, true,
                        "Found '" + field.getKey() + "' but expected one of " + expectedArrayFields);
            }
        }
        return new SchemaCheck(true, false, "No array data to compare");
    }

    /**
     * Confidence below 0.7 always normalizes. Above 0.9 only misplaced blocks do.
     * In between, missing metadata or a crossfit workout without crossfit data also count.
     */
    public static boolean shouldNormalize(ObjectNode workout, double confidence) {
        boolean misplacedBlocks = hasMisplacedCoachNotes(workout) || hasNestedDisciplineSpecific(workout);

        if (confidence < 0.7) {
            return true;
        }
        if (confidence > 0.9) {
            return misplacedBlocks;
        }
        if (misplacedBlocks) {
            return true;
        }
        if (object(workout, METADATA) == null) {
            return true;
        }
        return "crossfit".equals(WorkoutFields.discipline(workout))
                && object(object(workout, DISCIPLINE_SPECIFIC), "crossfit") == null;
    }

    private static boolean hasMisplacedCoachNotes(ObjectNode workout) {
        JsonNode disciplineSpecific = object(workout, DISCIPLINE_SPECIFIC);
        return disciplineSpecific != null && disciplineSpecific.has("coach_notes");
    }

    private static boolean hasNestedDisciplineSpecific(ObjectNode workout) {
        JsonNode metrics = object(workout, PERFORMANCE_METRICS);
        return metrics != null && metrics.has(DISCIPLINE_SPECIFIC);
    }
}
