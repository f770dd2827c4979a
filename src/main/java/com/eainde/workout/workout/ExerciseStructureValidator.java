package com.eainde.workout.workout;

import com.eainde.workout.model.StructuredModelClient;
import com.eainde.workout.prompt.PromptLoader;
import com.eainde.workout.tool.output.WorkoutCharacteristics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.eainde.workout.workout.WorkoutFields.PERFORMANCE_METRICS;
import static com.eainde.workout.workout.WorkoutFields.SUBJECTIVE_FEEDBACK;
import static com.eainde.workout.workout.WorkoutFields.object;
import static com.eainde.workout.workout.WorkoutFields.present;

/**
 * Checks that a workout describes actual work. Three tiers, cheapest first:
 * structural arrays in the discipline block, completion indicators for qualitative
 * workouts, and finally a semantic check by the model.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExerciseStructureValidator {

    private static final String PURPOSE = "exercise_structure_check";

    private final StructuredModelClient modelClient;
    private final PromptLoader promptLoader;

    public boolean hasExerciseStructure(ObjectNode workout, WorkoutCharacteristics characteristics) {
        JsonNode disciplineData = WorkoutFields.disciplineData(workout, WorkoutFields.discipline(workout));

        if (WorkoutFields.hasStructuralArray(disciplineData)) {
            log.debug("Exercise structure found in discipline arrays");
            return true;
        }

        if (characteristics != null && characteristics.qualitative()) {
            boolean valid = isCompleteQualitativeWorkout(workout);
            log.debug("Qualitative workout completion check: {}", valid);
            return valid;
        }

        if (disciplineData == null) {
            log.info("No discipline-specific data, no exercise structure");
            return false;
        }

        return semanticCheck(workout);
    }

    static boolean isCompleteQualitativeWorkout(ObjectNode workout) {
        boolean identified = present(workout, "workout_name")
                || present(workout, "workout_type")
                || present(workout, WorkoutFields.DISCIPLINE);
        if (!identified) {
            return false;
        }
        JsonNode feedback = object(workout, SUBJECTIVE_FEEDBACK);
        return present(workout, "duration")
                || present(workout, "session_duration")
                || present(object(workout, PERFORMANCE_METRICS), "calories_burned")
                || present(feedback, "enjoyment")
                || present(feedback, "notes")
                || present(workout, "date");
    }

    private boolean semanticCheck(ObjectNode workout) {
        try {
            JsonNode answer = modelClient.callJson(PURPOSE, promptLoader.get("exercise-structure-check"),
                    "WORKOUT DATA:\n" + workout.toPrettyString());
            JsonNode hasExercises = answer.get("hasExercises");
            if (hasExercises == null || !hasExercises.isBoolean()) {
                log.warn("Semantic exercise check returned no hasExercises flag, treating as missing");
                return false;
            }
            log.info("Semantic exercise check: hasExercises={}, reasoning={}",
                    hasExercises.booleanValue(), answer.path("reasoning").asText(""));
            return hasExercises.booleanValue();
        } catch (RuntimeException e) {
            boolean permissive = present(workout, "duration")
                    || present(workout, "session_duration")
                    || present(workout, PERFORMANCE_METRICS);
            log.warn("Semantic exercise check failed, defaulting to {}: {}", permissive, e.getMessage());
            return permissive;
        }
    }
}
