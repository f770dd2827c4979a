package com.eainde.workout.workout;

import java.time.Clock;
import java.util.UUID;

public final class WorkoutIds {

    private WorkoutIds() {
    }

    /**
     * {@code workout_<userId>_<epochMillis>_<shortId>}, where shortId is 9 lowercase alphanumerics.
     */
    public static String newWorkoutId(String userId, Clock clock) {
        String shortId = UUID.randomUUID().toString().replace("-", "").substring(0, 9);
        return "workout_" + userId + "_" + clock.millis() + "_" + shortId;
    }
}
