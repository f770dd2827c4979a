package com.eainde.workout.tool.output;

public record WorkoutSummary(String summary) implements ToolOutput {
}
