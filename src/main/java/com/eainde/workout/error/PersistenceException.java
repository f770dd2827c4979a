package com.eainde.workout.error;

public class PersistenceException extends WorkoutLoggerException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
