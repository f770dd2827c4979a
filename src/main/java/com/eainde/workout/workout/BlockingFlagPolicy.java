package com.eainde.workout.workout;

import java.util.List;

/**
 * Which validation flags stop a workout from being saved, and how that is explained.
 *
 * <p>Slash commands are explicit logging requests, so nothing blocks them. Qualitative
 * workouts (yoga, walks, classes) are never expected to carry performance numbers.</p>
 */
public final class BlockingFlagPolicy {

    public static final String PLANNING_INQUIRY = "planning_inquiry";
    public static final String NO_PERFORMANCE_DATA = "no_performance_data";
    public static final String ADVICE_SEEKING = "advice_seeking";
    public static final String FUTURE_PLANNING = "future_planning";
    public static final String INSUFFICIENT_DATA = "insufficient_data";
    public static final String NO_EXERCISE_DATA = "no_exercise_data";

    public static final String INSUFFICIENT_DATA_REASON =
            "Workout appears to be a reflection or comment without actual exercise data (completeness < 20%)";
    public static final String NO_EXERCISE_DATA_REASON =
            "No exercise structure found in workout data - unable to log workout without exercises or rounds";

    private static final List<String> QUALITATIVE_BLOCKING =
            List.of(PLANNING_INQUIRY, ADVICE_SEEKING, FUTURE_PLANNING);
    private static final List<String> QUANTITATIVE_BLOCKING =
            List.of(PLANNING_INQUIRY, NO_PERFORMANCE_DATA, ADVICE_SEEKING, FUTURE_PLANNING);

    private BlockingFlagPolicy() {
    }

    public static List<String> blockingSet(boolean slashCommand, boolean qualitative) {
        if (slashCommand) {
            return List.of();
        }
        return qualitative ? QUALITATIVE_BLOCKING : QUANTITATIVE_BLOCKING;
    }

    /**
     * The members of {@code validationFlags} that block, in flag order.
     */
    public static List<String> detect(List<String> validationFlags, boolean slashCommand, boolean qualitative) {
        List<String> blocking = blockingSet(slashCommand, qualitative);
        return validationFlags.stream()
                .filter(blocking::contains)
                .distinct()
                .toList();
    }

    public static String reason(List<String> blockingFlags, boolean slashCommand, boolean qualitative) {
        if (slashCommand) {
            return "Unable to extract any workout information from slash command content";
        }
        if (blockingFlags.contains(NO_PERFORMANCE_DATA) && !qualitative) {
            return "No performance data found for strength/power workout";
        }
        return "Not a workout log - appears to be planning/advice seeking";
    }
}
