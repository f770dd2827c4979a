package com.eainde.workout.tool;

import com.eainde.workout.agent.ExtractionRun;
import com.eainde.workout.error.ClassificationException;
import com.eainde.workout.error.PreconditionException;
import com.eainde.workout.repair.ResponseRepair;
import com.eainde.workout.schema.WorkoutSchemaComposer;
import com.eainde.workout.store.ResultRole;
import com.eainde.workout.tool.output.ToolOutput;
import com.eainde.workout.tool.output.ValidationVerdict;
import com.eainde.workout.tool.output.WorkoutCharacteristics;
import com.eainde.workout.tool.output.WorkoutExtraction;
import com.eainde.workout.workout.BlockingFlagPolicy;
import com.eainde.workout.workout.ExerciseStructureValidator;
import com.eainde.workout.workout.NormalizationDecider;
import com.eainde.workout.workout.WorkoutCharacteristicsClassifier;
import com.eainde.workout.workout.WorkoutDateCorrector;
import com.eainde.workout.workout.WorkoutFields;
import com.eainde.workout.workout.WorkoutScoring;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * validate_workout_completeness: scores the extracted workout and decides, authoritatively,
 * whether it may be normalized and saved.
 */
@Slf4j
@Component
public class ValidateWorkoutCompletenessTool implements WorkoutTool {

    static final String MISSING_EXTRACTION = "Extraction not completed - call extract_workout_data first";
    static final String VALID_REASON = "Workout data is complete and ready to save";

    private final WorkoutCharacteristicsClassifier characteristicsClassifier;
    private final ExerciseStructureValidator exerciseStructureValidator;
    private final WorkoutSchemaComposer schemaComposer;
    private final Clock clock;
    private final double completenessFloor;

    public ValidateWorkoutCompletenessTool(WorkoutCharacteristicsClassifier characteristicsClassifier,
                                           ExerciseStructureValidator exerciseStructureValidator,
                                           WorkoutSchemaComposer schemaComposer,
                                           Clock clock,
                                           @Value("${workout-logger.validation.completeness-floor:0.2}") double completenessFloor) {
        this.characteristicsClassifier = characteristicsClassifier;
        this.exerciseStructureValidator = exerciseStructureValidator;
        this.schemaComposer = schemaComposer;
        this.clock = clock;
        this.completenessFloor = completenessFloor;
    }

    @Override
    public ToolId id() {
        return ToolId.VALIDATE_WORKOUT_COMPLETENESS;
    }

    @Override
    public ToolSpecification specification() {
        return ToolSpecification.builder()
                .name(id().toolName())
                .description("Validate the extracted workout. Returns isValid, shouldNormalize, shouldSave, "
                        + "confidence, completeness, blockingFlags and reason. If shouldSave is false, "
                        + "do not normalize or save this workout.")
                .parameters(JsonObjectSchema.builder()
                        .addBooleanProperty("isSlashCommand", "True when the message came from a slash command")
                        .addIntegerProperty(ToolInputs.WORKOUT_INDEX, "0-based index when the message has several workouts")
                        .build())
                .build();
    }

    @Override
    public ToolOutput execute(JsonNode input, ExtractionRun run) {
        Integer index = ToolInputs.workoutIndex(input);
        WorkoutExtraction extraction = run.results()
                .read(ResultRole.EXTRACTION, index, WorkoutExtraction.class)
                .orElseThrow(() -> new PreconditionException(MISSING_EXTRACTION));
        boolean slashCommand = ToolInputs.bool(input, "isSlashCommand", run.request().triggeredBySlashCommand());

        ObjectNode workout = ResponseRepair.fixDoubleEncodedProperties(extraction.workoutData().deepCopy());
        String completedAt = extraction.completedAt();

        double confidence = WorkoutScoring.calculateConfidence(workout);
        double completeness = WorkoutScoring.calculateCompleteness(workout);
        ObjectNode metadata = WorkoutFields.metadata(workout);
        metadata.put("data_confidence", confidence);
        metadata.put("data_completeness", completeness);

        WorkoutDateCorrector.correct(workout, completedAt, clock);

        WorkoutCharacteristics characteristics = classify(workout, extraction.userMessage());
        boolean qualitative = characteristics.qualitative();

        if (completeness < completenessFloor) {
            log.info("Blocking workout: completeness {} below {}", completeness, completenessFloor);
            return blocked(workout, completedAt, confidence, completeness, characteristics,
                    List.of(BlockingFlagPolicy.INSUFFICIENT_DATA), BlockingFlagPolicy.INSUFFICIENT_DATA_REASON);
        }

        if (!exerciseStructureValidator.hasExerciseStructure(workout, characteristics)) {
            log.info("Blocking workout: no exercise structure");
            return blocked(workout, completedAt, confidence, completeness, characteristics,
                    List.of(BlockingFlagPolicy.NO_EXERCISE_DATA), BlockingFlagPolicy.NO_EXERCISE_DATA_REASON);
        }

        String discipline = WorkoutFields.discipline(workout);
        NormalizationDecider.SchemaCheck schemaCheck =
                NormalizationDecider.checkSchemaStructure(workout, schemaComposer.expectedArrayFields(discipline));
        boolean forceNormalize = !schemaCheck.valid() && schemaCheck.forceNormalize();
        if (forceNormalize) {
            log.info("Schema mismatch for {}: {}", discipline, schemaCheck.detail());
            WorkoutFields.addFlag(workout, NormalizationDecider.SCHEMA_MISMATCH_FLAG);
        }
        boolean shouldNormalize = forceNormalize || NormalizationDecider.shouldNormalize(workout, confidence);

        List<String> validationFlags = WorkoutFields.validationFlagList(workout);
        List<String> blockingFlags = BlockingFlagPolicy.detect(validationFlags, slashCommand, qualitative);
        boolean canSave = blockingFlags.isEmpty();
        String reason = canSave ? VALID_REASON : BlockingFlagPolicy.reason(blockingFlags, slashCommand, qualitative);

        log.info("Validation result: shouldSave={}, shouldNormalize={}, confidence={}, completeness={}, blockingFlags={}",
                canSave, shouldNormalize, confidence, completeness, blockingFlags);
        return new ValidationVerdict(canSave, shouldNormalize, canSave, confidence, completeness,
                validationFlags, blockingFlags, characteristics, reason, workout, completedAt);
    }

    private WorkoutCharacteristics classify(ObjectNode workout, String userMessage) {
        try {
            return characteristicsClassifier.classify(workout, userMessage);
        } catch (ClassificationException e) {
            log.warn("Workout characteristics classification failed, treating as quantitative: {}", e.getMessage());
            return WorkoutCharacteristics.quantitativeFallback("Classification failed, defaulted to quantitative");
        }
    }

    private static ValidationVerdict blocked(ObjectNode workout, String completedAt, double confidence,
                                             double completeness, WorkoutCharacteristics characteristics,
                                             List<String> blockingFlags, String reason) {
        return new ValidationVerdict(false, false, false, confidence, completeness,
                WorkoutFields.validationFlagList(workout), blockingFlags, characteristics, reason,
                workout, completedAt);
    }
}
