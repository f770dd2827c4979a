package com.eainde.workout.tool.output;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a workout should be judged: activity/completion based (yoga, hiking)
 * or quantitative (sets, reps, loads, times).
 */
public record WorkoutCharacteristics(
        @JsonProperty("isQualitative") boolean qualitative,
        boolean requiresPreciseMetrics,
        String environment,
        String primaryFocus,
        double confidence,
        String reasoning
) {

    public static WorkoutCharacteristics quantitativeFallback(String reasoning) {
        return new WorkoutCharacteristics(false, true, "mixed", "mixed", 0.0, reasoning);
    }
}
