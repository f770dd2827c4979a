package com.eainde.workout.tool.output;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A tool call that did not produce a result: it threw, was unknown, or was blocked
 * by validation. Stored like any other result so later checks can see it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolFailure(
        String error,
        Boolean blocked,
        String reason,
        List<String> blockingFlags
) implements ToolOutput {

    public static ToolFailure of(String error) {
        return new ToolFailure(error, null, null, null);
    }

    public static ToolFailure blocked(String error, String reason, List<String> blockingFlags) {
        return new ToolFailure(error, Boolean.TRUE, reason, List.copyOf(blockingFlags));
    }

    public boolean wasBlocked() {
        return Boolean.TRUE.equals(blocked);
    }
}
