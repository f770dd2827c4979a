package com.eainde.workout.tool.output;

public record DisciplineDetection(
        String discipline,
        double confidence,
        String method,
        String reasoning
) implements ToolOutput {

    public static final String METHOD_AI = "ai_detection";
}
