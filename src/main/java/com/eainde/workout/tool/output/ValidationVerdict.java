package com.eainde.workout.tool.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Authoritative decision of validate_workout_completeness. Once {@code shouldSave} is false
 * no later step may normalize or save the workout at the same index.
 */
public record ValidationVerdict(
        @JsonProperty("isValid") boolean valid,
        boolean shouldNormalize,
        boolean shouldSave,
        double confidence,
        double completeness,
        List<String> validationFlags,
        List<String> blockingFlags,
        WorkoutCharacteristics workoutCharacteristics,
        String reason,
        ObjectNode workoutData,
        String completedAt
) implements ToolOutput {

    public boolean blocksSave() {
        return !shouldSave;
    }
}
