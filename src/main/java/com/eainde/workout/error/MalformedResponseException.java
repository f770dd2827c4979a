package com.eainde.workout.error;

/**
 * Raised when a model response could not be turned into JSON after every repair stage.
 */
public class MalformedResponseException extends WorkoutLoggerException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
