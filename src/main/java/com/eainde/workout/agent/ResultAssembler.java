package com.eainde.workout.agent;

import com.eainde.workout.api.WorkoutLogResult;
import com.eainde.workout.store.ResultRole;
import com.eainde.workout.store.ResultStore;
import com.eainde.workout.tool.output.SaveOutcome;
import com.eainde.workout.tool.output.ValidationVerdict;
import com.eainde.workout.tool.output.WorkoutExtraction;
import com.eainde.workout.workout.WorkoutFields;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the result store of a finished run into the caller-facing result.
 */
@Component
public class ResultAssembler {

    static final String NO_WORKOUT_DATA = "No workout data provided";
    static final String WORKFLOW_INCOMPLETE =
            "Workflow incomplete - the workout was not saved before the conversation ended";

    public WorkoutLogResult buildResult(ExtractionRun run, String finalText) {
        ResultStore results = run.results();

        List<WorkoutLogResult.SavedWorkout> saved = savedWorkouts(results);
        if (!saved.isEmpty()) {
            return WorkoutLogResult.saved(saved);
        }

        List<ValidationVerdict> verdicts = results.readAll(ResultRole.VALIDATION, ValidationVerdict.class);
        if (!verdicts.isEmpty()) {
            ValidationVerdict latest = verdicts.get(verdicts.size() - 1);
            if (latest.blocksSave()) {
                return WorkoutLogResult.blocked(latest.reason(), latest.blockingFlags(), latest.confidence());
            }
        }

        if (!workflowStarted(results)) {
            return WorkoutLogResult.skipped(finalText == null || finalText.isBlank() ? NO_WORKOUT_DATA : finalText);
        }
        return WorkoutLogResult.skipped(WORKFLOW_INCOMPLETE);
    }

    /**
     * True once any stage past discipline detection left a result, failures included.
     * Detection alone, or calls to unknown tools, means the model is still talking to the user.
     */
    private static boolean workflowStarted(ResultStore results) {
        return results.hasAny(ResultRole.EXTRACTION)
                || results.hasAny(ResultRole.VALIDATION)
                || results.hasAny(ResultRole.NORMALIZATION)
                || results.hasAny(ResultRole.SAVE);
    }

    private static List<WorkoutLogResult.SavedWorkout> savedWorkouts(ResultStore results) {
        List<WorkoutLogResult.SavedWorkout> saved = new ArrayList<>();
        for (int index = 0; index < results.count(ResultRole.SAVE); index++) {
            Optional<SaveOutcome> outcome = results.read(ResultRole.SAVE, index, SaveOutcome.class)
                    .filter(SaveOutcome::success);
            if (outcome.isEmpty()) {
                continue;
            }
            Optional<ValidationVerdict> verdict = results.read(ResultRole.VALIDATION, index, ValidationVerdict.class);
            Optional<WorkoutExtraction> extraction = results.read(ResultRole.EXTRACTION, index, WorkoutExtraction.class);

            String discipline = verdict.map(v -> WorkoutFields.discipline(v.workoutData()))
                    .or(() -> extraction.map(e -> WorkoutFields.discipline(e.workoutData())))
                    .orElse(null);
            Double confidence = verdict.map(ValidationVerdict::confidence).orElse(null);
            Double completeness = verdict.map(ValidationVerdict::completeness).orElse(null);

            saved.add(WorkoutLogResult.SavedWorkout.of(index, outcome.get().workoutId(), discipline,
                    confidence, completeness));
        }
        return saved;
    }
}
