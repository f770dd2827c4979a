package com.eainde.workout.workout;

import com.eainde.workout.error.ClassificationException;
import com.eainde.workout.model.StructuredModelClient;
import com.eainde.workout.prompt.PromptLoader;
import com.eainde.workout.tool.output.WorkoutCharacteristics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Asks the model whether a workout is qualitative (judged by completion) or
 * quantitative (judged by sets, loads and times).
 */
@Component
@RequiredArgsConstructor
public class WorkoutCharacteristicsClassifier {

    private static final String PURPOSE = "workout_characteristics";

    private final StructuredModelClient modelClient;
    private final PromptLoader promptLoader;

    /**
     * @throws ClassificationException when the model fails or answers without {@code isQualitative}
     */
    public WorkoutCharacteristics classify(ObjectNode workout, String userMessage) {
        String userPrompt = "USER MESSAGE:\n" + (userMessage == null ? "" : userMessage)
                + "\n\nWORKOUT DATA:\n" + workout.toPrettyString();

        JsonNode answer;
        try {
            answer = modelClient.callJson(PURPOSE, promptLoader.get("workout-characteristics"), userPrompt);
        } catch (RuntimeException e) {
            throw new ClassificationException("Workout characteristics classification failed", e);
        }

        JsonNode qualitative = answer.get("isQualitative");
        if (qualitative == null || !qualitative.isBoolean()) {
            throw new ClassificationException("Classification response has no isQualitative flag");
        }
        return new WorkoutCharacteristics(
                qualitative.booleanValue(),
                answer.path("requiresPreciseMetrics").asBoolean(!qualitative.booleanValue()),
                answer.path("environment").asText("mixed"),
                answer.path("primaryFocus").asText("mixed"),
                answer.path("confidence").asDouble(0.0),
                answer.path("reasoning").asText(""));
    }
}
