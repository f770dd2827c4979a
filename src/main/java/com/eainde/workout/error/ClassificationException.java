package com.eainde.workout.error;

/**
 * Discipline or workout-characteristics classification failed.
 * Always recovered by the caller with a conservative default.
 */
public class ClassificationException extends WorkoutLoggerException {

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
