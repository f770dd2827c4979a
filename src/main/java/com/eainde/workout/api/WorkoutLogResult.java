package com.eainde.workout.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Caller-facing outcome of one logging request.
 *
 * <p>Never carries an exception: every failure is a {@code success=false} result with a reason.
 * {@code allWorkouts} lists every workout saved during the run, in workout-index order.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkoutLogResult {

    private final boolean success;
    private final boolean skipped;
    private final String workoutId;
    private final String discipline;
    private final Double confidence;
    private final Double completeness;
    private final String reason;
    private final List<String> blockingFlags;
    private final List<SavedWorkout> allWorkouts;

    private WorkoutLogResult(boolean success, boolean skipped, String workoutId, String discipline,
                             Double confidence, Double completeness, String reason,
                             List<String> blockingFlags, List<SavedWorkout> allWorkouts) {
        this.success = success;
        this.skipped = skipped;
        this.workoutId = workoutId;
        this.discipline = discipline;
        this.confidence = confidence;
        this.completeness = completeness;
        this.reason = reason;
        this.blockingFlags = blockingFlags;
        this.allWorkouts = allWorkouts;
    }

    /**
     * At least one workout was saved. The first saved workout is the primary one.
     */
    public static WorkoutLogResult saved(List<SavedWorkout> savedWorkouts) {
        if (savedWorkouts == null || savedWorkouts.isEmpty()) {
            throw new IllegalArgumentException("saved() needs at least one saved workout");
        }
        SavedWorkout primary = savedWorkouts.get(0);
        return new WorkoutLogResult(true, false, primary.getWorkoutId(), primary.getDiscipline(),
                primary.getConfidence(), primary.getCompleteness(), null, null, List.copyOf(savedWorkouts));
    }

    /**
     * Validation refused the workout. The reason and flags come from the verdict.
     */
    public static WorkoutLogResult blocked(String reason, List<String> blockingFlags, Double confidence) {
        return new WorkoutLogResult(false, true, null, null, confidence, null, reason,
                blockingFlags == null ? List.of() : List.copyOf(blockingFlags), null);
    }

    public static WorkoutLogResult skipped(String reason) {
        return new WorkoutLogResult(false, true, null, null, null, null, reason, null, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public String getWorkoutId() {
        return workoutId;
    }

    public String getDiscipline() {
        return discipline;
    }

    public Double getConfidence() {
        return confidence;
    }

    public Double getCompleteness() {
        return completeness;
    }

    public String getReason() {
        return reason;
    }

    public List<String> getBlockingFlags() {
        return blockingFlags;
    }

    public List<SavedWorkout> getAllWorkouts() {
        return allWorkouts;
    }

    @Override
    public String toString() {
        return "WorkoutLogResult{success=" + success + ", skipped=" + skipped + ", workoutId=" + workoutId
                + ", discipline=" + discipline + ", reason=" + reason + ", blockingFlags=" + blockingFlags
                + ", saved=" + (allWorkouts == null ? 0 : allWorkouts.size()) + "}";
    }

    /**
     * One workout that reached the save step.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SavedWorkout {

        private final int workoutIndex;
        private final String workoutId;
        private final String discipline;
        private final Double confidence;
        private final Double completeness;
        private final boolean saved;

        private SavedWorkout(int workoutIndex, String workoutId, String discipline,
                             Double confidence, Double completeness) {
            this.workoutIndex = workoutIndex;
            this.workoutId = workoutId;
            this.discipline = discipline;
            this.confidence = confidence;
            this.completeness = completeness;
            this.saved = true;
        }

        public static SavedWorkout of(int workoutIndex, String workoutId, String discipline,
                                      Double confidence, Double completeness) {
            return new SavedWorkout(workoutIndex, workoutId, discipline, confidence, completeness);
        }

        public int getWorkoutIndex() {
            return workoutIndex;
        }

        public String getWorkoutId() {
            return workoutId;
        }

        public String getDiscipline() {
            return discipline;
        }

        public Double getConfidence() {
            return confidence;
        }

        public Double getCompleteness() {
            return completeness;
        }

        public boolean isSaved() {
            return saved;
        }
    }
}
