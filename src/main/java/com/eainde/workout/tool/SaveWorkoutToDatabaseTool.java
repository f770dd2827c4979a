package com.eainde.workout.tool;

import com.eainde.workout.agent.ExtractionRun;
import com.eainde.workout.api.TemplateContext;
import com.eainde.workout.api.WorkoutLogRequest;
import com.eainde.workout.error.PersistenceException;
import com.eainde.workout.error.PreconditionException;
import com.eainde.workout.persistence.DerivedRecordTrigger;
import com.eainde.workout.persistence.WorkoutPersistence;
import com.eainde.workout.persistence.WorkoutRecord;
import com.eainde.workout.store.ResultRole;
import com.eainde.workout.store.ResultStore;
import com.eainde.workout.thread.MdcAwareExecutor;
import com.eainde.workout.tool.output.NormalizationOutcome;
import com.eainde.workout.tool.output.SaveOutcome;
import com.eainde.workout.tool.output.ToolOutput;
import com.eainde.workout.tool.output.ValidationVerdict;
import com.eainde.workout.tool.output.WorkoutExtraction;
import com.eainde.workout.tool.output.WorkoutSummary;
import com.eainde.workout.workout.WorkoutFields;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * save_workout_to_database: persists the final candidate, then fires the search index and
 * derived-record work in the background. Only reachable through the blocking gate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SaveWorkoutToDatabaseTool implements WorkoutTool {

    static final String MISSING_EXTRACTION = "Extraction not completed - call extract_workout_data first";
    static final String MISSING_VALIDATION = "Validation not completed - call validate_workout_completeness first";
    static final String MISSING_SUMMARY = "Summary not generated - call generate_workout_summary first";
    static final String MISSING_IDENTITY = "Workout data is missing workout_id or discipline";

    private final WorkoutPersistence persistence;
    private final DerivedRecordTrigger derivedRecordTrigger;
    private final MdcAwareExecutor backgroundExecutor;

    @Override
    public ToolId id() {
        return ToolId.SAVE_WORKOUT_TO_DATABASE;
    }

    @Override
    public ToolSpecification specification() {
        return ToolSpecification.builder()
                .name(id().toolName())
                .description("Save the workout. Final step; requires extraction, validation (shouldSave: true) "
                        + "and a generated summary for the same workoutIndex.")
                .parameters(JsonObjectSchema.builder()
                        .addIntegerProperty(ToolInputs.WORKOUT_INDEX, "0-based index when the message has several workouts")
                        .build())
                .build();
    }

    @Override
    public ToolOutput execute(JsonNode input, ExtractionRun run) {
        Integer index = ToolInputs.workoutIndex(input);
        ResultStore results = run.results();

        WorkoutExtraction extraction = results.read(ResultRole.EXTRACTION, index, WorkoutExtraction.class)
                .orElseThrow(() -> new PreconditionException(MISSING_EXTRACTION));
        ValidationVerdict verdict = results.read(ResultRole.VALIDATION, index, ValidationVerdict.class)
                .orElseThrow(() -> new PreconditionException(MISSING_VALIDATION));
        WorkoutSummary summary = results.read(ResultRole.SUMMARY, index, WorkoutSummary.class)
                .orElseThrow(() -> new PreconditionException(MISSING_SUMMARY));

        Optional<NormalizationOutcome> normalization =
                results.read(ResultRole.NORMALIZATION, index, NormalizationOutcome.class);
        if (normalization.isPresent() && !normalization.get().valid()) {
            NormalizationOutcome outcome = normalization.get();
            throw new PreconditionException(String.format(Locale.ROOT,
                    "Cannot save workout: Normalization determined the workout data is invalid or insufficient. "
                            + "Confidence: %.2f, Issues: %d",
                    outcome.normalizationConfidence(), outcome.issuesFound()));
        }

        ObjectNode workout = normalization.map(NormalizationOutcome::normalizedData).orElse(verdict.workoutData());
        String workoutId = WorkoutFields.text(workout, "workout_id");
        String discipline = WorkoutFields.discipline(workout);
        if (workoutId == null || discipline == null) {
            throw new PreconditionException(MISSING_IDENTITY);
        }

        WorkoutLogRequest request = run.request();
        WorkoutRecord record = toRecord(workout, workoutId, discipline, request, extraction, verdict, summary);

        String savedId;
        try {
            savedId = persistence.save(record);
        } catch (PersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to save workout " + workoutId, e);
        }

        ObjectNode indexed = workout.deepCopy();
        backgroundExecutor.runDetached("search-index:" + savedId,
                () -> persistence.indexForSearch(indexed, summary.summary()));
        backgroundExecutor.runDetached("derived-records:" + savedId,
                () -> derivedRecordTrigger.trigger(savedId, indexed));

        boolean templateLinked = linkTemplate(request, savedId);
        log.info("Workout {} saved (discipline={}, templateLinked={})", savedId, discipline, templateLinked);
        return new SaveOutcome(savedId, true, templateLinked);
    }

    private boolean linkTemplate(WorkoutLogRequest request, String workoutId) {
        TemplateContext template = request.getTemplateContext();
        if (template == null || template.templateId() == null) {
            return false;
        }
        try {
            return persistence.linkToTemplate(request.getUserId(), template.templateId(), template.groupId(), workoutId);
        } catch (RuntimeException e) {
            log.warn("Failed to link workout {} to template {}: {}", workoutId, template.templateId(), e.getMessage());
            return false;
        }
    }

    private static WorkoutRecord toRecord(ObjectNode workout, String workoutId, String discipline,
                                          WorkoutLogRequest request, WorkoutExtraction extraction,
                                          ValidationVerdict verdict, WorkoutSummary summary) {
        WorkoutRecord record = new WorkoutRecord(workoutId, request.getUserId(), discipline);
        record.setCoachIds(request.getCoachIds() == null ? null : String.join(",", request.getCoachIds()));
        record.setConversationId(request.getConversationId());
        record.setWorkoutName(WorkoutFields.text(workout, "workout_name"));
        record.setCompletedAt(verdict.completedAt() != null ? verdict.completedAt() : extraction.completedAt());
        record.setSummary(summary.summary());
        record.setConfidence(WorkoutFields.metadata(workout).path("data_confidence").asDouble(verdict.confidence()));
        record.setCompleteness(verdict.completeness());
        record.setGenerationMethod(extraction.generationMethod());
        if (request.getTemplateContext() != null) {
            record.setTemplateId(request.getTemplateContext().templateId());
            record.setGroupId(request.getTemplateContext().groupId());
        }
        record.setWorkoutJson(workout.toString());
        return record;
    }
}
