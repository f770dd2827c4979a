package com.eainde.workout.workout;

/**
 * One problem the normalizer found. {@code severity} is {@code error} or {@code warning}.
 */
public record NormalizationIssue(String type, String severity, String field, String description, boolean corrected) {

    public boolean isError() {
        return "error".equalsIgnoreCase(severity);
    }
}
