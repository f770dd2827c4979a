package com.eainde.workout.tool.output;

public record SaveOutcome(
        String workoutId,
        boolean success,
        boolean templateLinked
) implements ToolOutput {
}
