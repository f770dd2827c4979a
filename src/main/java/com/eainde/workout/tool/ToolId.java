package com.eainde.workout.tool;

import com.eainde.workout.store.ResultRole;

import java.util.Arrays;
import java.util.Optional;

/**
 * The six tools the logging agent can call, with the wire name the model uses
 * and the result-store role their output is kept under.
 */
public enum ToolId {
    DETECT_DISCIPLINE("detect_discipline", ResultRole.DISCIPLINE),
    EXTRACT_WORKOUT_DATA("extract_workout_data", ResultRole.EXTRACTION),
    VALIDATE_WORKOUT_COMPLETENESS("validate_workout_completeness", ResultRole.VALIDATION),
    NORMALIZE_WORKOUT_DATA("normalize_workout_data", ResultRole.NORMALIZATION),
    GENERATE_WORKOUT_SUMMARY("generate_workout_summary", ResultRole.SUMMARY),
    SAVE_WORKOUT_TO_DATABASE("save_workout_to_database", ResultRole.SAVE);

    private final String toolName;
    private final ResultRole role;

    ToolId(String toolName, ResultRole role) {
        this.toolName = toolName;
        this.role = role;
    }

    public String toolName() {
        return toolName;
    }

    public ResultRole role() {
        return role;
    }

    public static Optional<ToolId> fromToolName(String name) {
        return Arrays.stream(values())
                .filter(id -> id.toolName.equals(name))
                .findFirst();
    }
}
