package com.eainde.workout.tool;

import com.eainde.workout.agent.ExtractionRun;
import com.eainde.workout.error.PreconditionException;
import com.eainde.workout.store.ResultRole;
import com.eainde.workout.store.ResultStore;
import com.eainde.workout.tool.output.NormalizationOutcome;
import com.eainde.workout.tool.output.ToolOutput;
import com.eainde.workout.tool.output.ValidationVerdict;
import com.eainde.workout.tool.output.WorkoutExtraction;
import com.eainde.workout.tool.output.WorkoutSummary;
import com.eainde.workout.workout.WorkoutSummaryGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class GenerateWorkoutSummaryTool implements WorkoutTool {

    static final String MISSING_WORKOUT = "No workout data to summarize - call extract_workout_data first";

    private final WorkoutSummaryGenerator summaryGenerator;

    @Override
    public ToolId id() {
        return ToolId.GENERATE_WORKOUT_SUMMARY;
    }

    @Override
    public ToolSpecification specification() {
        return ToolSpecification.builder()
                .name(id().toolName())
                .description("Generate a short human-readable summary of the workout. Required before saving.")
                .parameters(JsonObjectSchema.builder()
                        .addStringProperty("originalMessage", "The user's original message")
                        .addIntegerProperty(ToolInputs.WORKOUT_INDEX, "0-based index when the message has several workouts")
                        .build())
                .build();
    }

    @Override
    public ToolOutput execute(JsonNode input, ExtractionRun run) {
        Integer index = ToolInputs.workoutIndex(input);
        ObjectNode workout = bestCandidate(run.results(), index)
                .orElseThrow(() -> new PreconditionException(MISSING_WORKOUT));

        String originalMessage = ToolInputs.text(input, "originalMessage");
        if (originalMessage == null) {
            originalMessage = run.results().read(ResultRole.EXTRACTION, index, WorkoutExtraction.class)
                    .map(WorkoutExtraction::userMessage)
                    .orElse(run.request().getUserMessage());
        }
        return new WorkoutSummary(summaryGenerator.generate(workout, originalMessage));
    }

    /**
     * Valid normalized data, then the validated candidate, then the raw extraction.
     */
    static Optional<ObjectNode> bestCandidate(ResultStore results, Integer index) {
        return results.read(ResultRole.NORMALIZATION, index, NormalizationOutcome.class)
                .filter(NormalizationOutcome::valid)
                .map(NormalizationOutcome::normalizedData)
                .or(() -> results.read(ResultRole.VALIDATION, index, ValidationVerdict.class)
                        .map(ValidationVerdict::workoutData))
                .or(() -> results.read(ResultRole.EXTRACTION, index, WorkoutExtraction.class)
                        .map(WorkoutExtraction::workoutData));
    }
}
