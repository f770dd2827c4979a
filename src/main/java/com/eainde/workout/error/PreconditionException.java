package com.eainde.workout.error;

/**
 * A tool was invoked before the step it depends on produced a result.
 * The message names the missing step so the model can recover.
 */
public class PreconditionException extends WorkoutLoggerException {

    public PreconditionException(String message) {
        super(message);
    }
}
