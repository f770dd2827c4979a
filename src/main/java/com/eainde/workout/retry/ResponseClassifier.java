package com.eainde.workout.retry;

/**
 * Classifies the model's final text when a run ended without saving anything.
 */
public interface ResponseClassifier {

    boolean classify(String response);
}
