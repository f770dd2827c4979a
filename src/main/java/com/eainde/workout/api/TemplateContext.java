package com.eainde.workout.api;

/**
 * Present when the logged workout came from a training-program template.
 */
public record TemplateContext(String programId, String templateId, String groupId) {
}
