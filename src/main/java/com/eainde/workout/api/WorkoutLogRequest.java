package com.eainde.workout.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkoutLogRequest {
    // Identity
    private String userId;
    private List<String> coachIds;
    private String conversationId;

    // Message
    private String userMessage;
    private String userTimezone;
    private String messageTimestamp; // ISO-8601
    private String slashCommand;     // e.g. "log-workout"; null for natural language

    // Program linkage
    private TemplateContext templateContext;

    public boolean triggeredBySlashCommand() {
        return slashCommand != null && !slashCommand.isBlank();
    }
}
