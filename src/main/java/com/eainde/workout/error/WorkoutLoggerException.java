package com.eainde.workout.error;

/**
 * Root of the extraction error taxonomy. Every failure raised inside a tool or the
 * orchestration loop is one of these, so callers can map them to structured results.
 */
public class WorkoutLoggerException extends RuntimeException {

    public WorkoutLoggerException(String message) {
        super(message);
    }

    public WorkoutLoggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
