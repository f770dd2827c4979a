package com.eainde.workout.tool.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

public record NormalizationOutcome(
        ObjectNode normalizedData,
        @JsonProperty("isValid") boolean valid,
        int issuesFound,
        int issuesCorrected,
        String normalizationSummary,
        double normalizationConfidence
) implements ToolOutput {
}
