package com.eainde.workout.workout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import static com.eainde.workout.workout.WorkoutFields.PERFORMANCE_METRICS;
import static com.eainde.workout.workout.WorkoutFields.SUBJECTIVE_FEEDBACK;
import static com.eainde.workout.workout.WorkoutFields.object;
import static com.eainde.workout.workout.WorkoutFields.present;

/**
 * Confidence and completeness scores written into {@code metadata.data_confidence}
 * and {@code metadata.data_completeness}. Both are in [0, 1] and rounded to two decimals.
 */
public final class WorkoutScoring {

    private WorkoutScoring() {
    }

    public static double calculateConfidence(ObjectNode workout) {
        double score = 0.5;

        if (present(workout, "workout_name")) {
            score += 0.2;
        }
        JsonNode crossfit = object(object(workout, WorkoutFields.DISCIPLINE_SPECIFIC), "crossfit");
        if (present(object(crossfit, "performance_data"), "total_time")) {
            score += 0.2;
        }
        if (present(object(workout, PERFORMANCE_METRICS), "perceived_exertion")) {
            score += 0.1;
        }
        if (present(object(workout, SUBJECTIVE_FEEDBACK), "notes") || present(workout, "coach_notes")) {
            score += 0.1;
        }
        score -= 0.05 * WorkoutFields.validationFlags(workout).size();

        return round(Math.max(0.1, Math.min(1.0, score)));
    }

    /**
     * Weighted field coverage. Identity fields (date, discipline, type) and the defaulted
     * intensity values carry no weight, so a message with no actual training content
     * stays below the 0.2 floor.
     */
    public static double calculateCompleteness(ObjectNode workout) {
        double score = 0.0;

        if (present(workout, "workout_name")) {
            score += 0.1;
        }
        if (present(workout, "duration") || present(workout, "session_duration")) {
            score += 0.15;
        }

        JsonNode disciplineData = WorkoutFields.disciplineData(workout, WorkoutFields.discipline(workout));
        if (WorkoutFields.hasStructuralArray(disciplineData)) {
            score += 0.4;
        } else if (disciplineData != null) {
            score += 0.1;
        }

        JsonNode metrics = object(workout, PERFORMANCE_METRICS);
        if (present(metrics, "heart_rate") || present(metrics, "calories_burned")) {
            score += 0.1;
        }
        JsonNode feedback = object(workout, SUBJECTIVE_FEEDBACK);
        if (present(feedback, "enjoyment") || present(feedback, "difficulty") || present(feedback, "notes")) {
            score += 0.1;
        }
        if (present(workout, "pr_achievements")) {
            score += 0.05;
        }
        if (present(workout, "location")) {
            score += 0.05;
        }
        if (present(workout, "coach_notes")) {
            score += 0.05;
        }

        return round(Math.min(1.0, score));
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
