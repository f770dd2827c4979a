package com.eainde.workout.workout;

import com.eainde.workout.error.MalformedResponseException;
import com.eainde.workout.model.StructuredModelClient;
import com.eainde.workout.prompt.PromptLoader;
import com.eainde.workout.repair.ResponseRepair;
import com.eainde.workout.schema.WorkoutSchemaComposer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Has the model compare a workout against the universal schema and return a corrected copy.
 * A failed call is not fatal: the workout comes back unchanged and marked invalid.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkoutNormalizer {

    static final String PURPOSE = "workout_normalization";
    static final double FAILURE_CONFIDENCE = 0.3;

    private final StructuredModelClient modelClient;
    private final PromptLoader promptLoader;
    private final WorkoutSchemaComposer schemaComposer;

    public record Result(boolean valid, ObjectNode normalizedData, List<NormalizationIssue> issues,
                         double confidence, String summary) {

        public int correctedCount() {
            return (int) issues.stream().filter(NormalizationIssue::corrected).count();
        }
    }

    public Result normalize(ObjectNode workout) {
        String discipline = WorkoutFields.discipline(workout);
        String systemPrompt = promptLoader.render("workout-normalization", Map.of(
                "discipline", discipline == null ? "unknown" : discipline,
                "expectedArrayFields", String.join(", ", schemaComposer.expectedArrayFields(discipline))));

        try {
            JsonNode answer = modelClient.callJson(PURPOSE, systemPrompt,
                    "WORKOUT DATA TO NORMALIZE:\n" + workout.toPrettyString());
            return toResult(answer);
        } catch (RuntimeException e) {
            log.warn("Normalization failed, keeping original workout data: {}", e.getMessage());
            NormalizationIssue issue = new NormalizationIssue("system_error", "error", "normalization",
                    "Normalization process failed: " + e.getMessage(), false);
            return new Result(false, workout, List.of(issue), FAILURE_CONFIDENCE,
                    "Normalization failed due to system error");
        }
    }

    private static Result toResult(JsonNode answer) {
        JsonNode valid = answer.get("isValid");
        JsonNode data = answer.get("normalizedData");
        if (valid == null || !valid.isBoolean() || data == null || !data.isObject()) {
            throw new MalformedResponseException("Normalization response is missing isValid or normalizedData");
        }

        List<NormalizationIssue> issues = new ArrayList<>();
        JsonNode rawIssues = answer.path("issues");
        if (rawIssues.isArray()) {
            for (JsonNode issue : rawIssues) {
                issues.add(new NormalizationIssue(
                        issue.path("type").asText("structure"),
                        issue.path("severity").asText("warning"),
                        issue.path("field").asText(""),
                        issue.path("description").asText(""),
                        issue.path("corrected").asBoolean(false)));
            }
        }

        ObjectNode normalized = ResponseRepair.fixDoubleEncodedProperties((ObjectNode) data);
        return new Result(valid.booleanValue(), normalized, List.copyOf(issues),
                answer.path("confidence").asDouble(0.5), answer.path("summary").asText(""));
    }

    /**
     * "Normalization PASSED (confidence: 0.85)" followed by error, warning and corrected-field lines.
     */
    public static String summarize(Result result) {
        StringBuilder summary = new StringBuilder()
                .append("Normalization ")
                .append(result.valid() ? "PASSED" : "FAILED")
                .append(String.format(Locale.ROOT, " (confidence: %.2f)", result.confidence()));

        List<NormalizationIssue> errors = result.issues().stream().filter(NormalizationIssue::isError).toList();
        List<NormalizationIssue> warnings = result.issues().stream().filter(i -> !i.isError()).toList();
        List<NormalizationIssue> corrected = result.issues().stream().filter(NormalizationIssue::corrected).toList();

        appendLine(summary, "Errors", errors);
        appendLine(summary, "Warnings", warnings);
        appendLine(summary, "Normalized", corrected);
        return summary.toString();
    }

    private static void appendLine(StringBuilder summary, String label, List<NormalizationIssue> issues) {
        if (issues.isEmpty()) {
            return;
        }
        summary.append('\n').append(label).append(" (").append(issues.size()).append("): ")
                .append(issues.stream().map(NormalizationIssue::field).collect(Collectors.joining(", ")));
    }
}
