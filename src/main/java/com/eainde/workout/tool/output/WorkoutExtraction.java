package com.eainde.workout.tool.output;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Output of extract_workout_data.
 *
 * @param workoutData      the structured workout candidate, system fields already stamped
 * @param completedAt      ISO-8601 instant the workout was completed
 * @param generationMethod {@code tool} when the forced tool call worked, {@code fallback} otherwise
 * @param userMessage      the text the candidate was extracted from
 */
public record WorkoutExtraction(
        ObjectNode workoutData,
        String completedAt,
        String generationMethod,
        String userMessage
) implements ToolOutput {

    public static final String GENERATION_TOOL = "tool";
    public static final String GENERATION_FALLBACK = "fallback";
}
