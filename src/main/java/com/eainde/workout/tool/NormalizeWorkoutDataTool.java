package com.eainde.workout.tool;

import com.eainde.workout.agent.ExtractionRun;
import com.eainde.workout.error.PreconditionException;
import com.eainde.workout.store.ResultRole;
import com.eainde.workout.store.ResultStore;
import com.eainde.workout.tool.output.NormalizationOutcome;
import com.eainde.workout.tool.output.ToolOutput;
import com.eainde.workout.tool.output.ValidationVerdict;
import com.eainde.workout.tool.output.WorkoutExtraction;
import com.eainde.workout.workout.NormalizationIssue;
import com.eainde.workout.workout.WorkoutFields;
import com.eainde.workout.workout.WorkoutNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * normalize_workout_data: schema clean-up pass, only reachable through the blocking gate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NormalizeWorkoutDataTool implements WorkoutTool {

    static final String NORMALIZED_FLAG = "normalized";
    static final String MISSING_WORKOUT = "No workout data to normalize - call extract_workout_data first";

    private final WorkoutNormalizer normalizer;

    @Override
    public ToolId id() {
        return ToolId.NORMALIZE_WORKOUT_DATA;
    }

    @Override
    public ToolSpecification specification() {
        return ToolSpecification.builder()
                .name(id().toolName())
                .description("Normalize the validated workout against the universal schema. Only call when "
                        + "validate_workout_completeness returned shouldNormalize: true.")
                .parameters(JsonObjectSchema.builder()
                        .addIntegerProperty(ToolInputs.WORKOUT_INDEX, "0-based index when the message has several workouts")
                        .build())
                .build();
    }

    @Override
    public ToolOutput execute(JsonNode input, ExtractionRun run) {
        Integer index = ToolInputs.workoutIndex(input);
        ResultStore results = run.results();
        Optional<ValidationVerdict> verdict = results.read(ResultRole.VALIDATION, index, ValidationVerdict.class);

        ObjectNode source = verdict.map(ValidationVerdict::workoutData)
                .or(() -> results.read(ResultRole.EXTRACTION, index, WorkoutExtraction.class)
                        .map(WorkoutExtraction::workoutData))
                .orElseThrow(() -> new PreconditionException(MISSING_WORKOUT));
        double originalConfidence = verdict.map(ValidationVerdict::confidence)
                .orElseGet(() -> WorkoutFields.metadata(source).path("data_confidence").asDouble(0.0));

        WorkoutNormalizer.Result result = normalizer.normalize(source.deepCopy());
        int corrected = result.correctedCount();

        ObjectNode data = source;
        if (result.valid() || corrected > 0) {
            data = result.normalizedData();
            double confidence = originalConfidence;
            if (result.confidence() > originalConfidence) {
                confidence = Math.min(originalConfidence + 0.1, result.confidence());
            }
            WorkoutFields.metadata(data).put("data_confidence", confidence);
            WorkoutFields.addFlag(data, NORMALIZED_FLAG);
            for (NormalizationIssue issue : result.issues()) {
                if (issue.corrected() && !issue.field().isBlank()) {
                    WorkoutFields.addFlag(data, issue.field());
                }
            }
        }

        String summary = WorkoutNormalizer.summarize(result);
        log.info("Normalization finished: valid={}, issues={}, corrected={}, confidence={}",
                result.valid(), result.issues().size(), corrected, result.confidence());
        return new NormalizationOutcome(data, result.valid(), result.issues().size(), corrected, summary,
                result.confidence());
    }
}
