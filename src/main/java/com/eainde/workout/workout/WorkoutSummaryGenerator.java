package com.eainde.workout.workout;

import com.eainde.workout.model.StructuredModelClient;
import com.eainde.workout.prompt.PromptLoader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class WorkoutSummaryGenerator {

    static final String PURPOSE = "workout_summary";

    private final StructuredModelClient modelClient;
    private final PromptLoader promptLoader;

    public String generate(ObjectNode workout, String originalMessage) {
        String userPrompt = "ORIGINAL MESSAGE:\n" + (originalMessage == null ? "" : originalMessage)
                + "\n\nWORKOUT DATA:\n" + workout.toPrettyString();
        try {
            return modelClient.callText(PURPOSE, promptLoader.get("workout-summary"), userPrompt);
        } catch (RuntimeException e) {
            String fallback = fallbackSummary(workout);
            log.warn("Summary generation failed, using fallback '{}': {}", fallback, e.getMessage());
            return fallback;
        }
    }

    /**
     * "Completed Fran (crossfit) in 7min"; the duration part is left out when unknown.
     */
    public static String fallbackSummary(ObjectNode workout) {
        String name = WorkoutFields.text(workout, "workout_name");
        String discipline = WorkoutFields.discipline(workout);
        StringBuilder summary = new StringBuilder("Completed ")
                .append(name == null ? "Workout" : name)
                .append(" (").append(discipline == null ? "unknown" : discipline).append(')');

        JsonNode duration = workout.get("duration");
        if (duration != null && duration.isNumber()) {
            summary.append(" in ").append(Math.round(duration.asDouble())).append("min");
        }
        return summary.toString();
    }
}
