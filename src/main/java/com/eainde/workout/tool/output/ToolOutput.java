package com.eainde.workout.tool.output;

/**
 * Result of one tool execution. One variant per tool plus {@link ToolFailure},
 * so the result store never holds untyped payloads.
 */
public sealed interface ToolOutput
        permits DisciplineDetection, WorkoutExtraction, ValidationVerdict, NormalizationOutcome,
        WorkoutSummary, SaveOutcome, ToolFailure {
}
