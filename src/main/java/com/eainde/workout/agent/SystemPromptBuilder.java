package com.eainde.workout.agent;

import com.eainde.workout.api.WorkoutLogRequest;
import com.eainde.workout.prompt.PromptLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;

@Slf4j
@Component
public class SystemPromptBuilder {

    private final PromptLoader promptLoader;
    private final Clock clock;
    private final String defaultTimezone;

    public SystemPromptBuilder(PromptLoader promptLoader,
                               Clock clock,
                               @Value("${workout-logger.default-timezone:America/Los_Angeles}") String defaultTimezone) {
        this.promptLoader = promptLoader;
        this.clock = clock;
        this.defaultTimezone = defaultTimezone;
    }

    public String build(WorkoutLogRequest request) {
        String timezone = request.getUserTimezone() == null || request.getUserTimezone().isBlank()
                ? defaultTimezone
                : request.getUserTimezone();
        return promptLoader.render("workout-logger-system", Map.of(
                "currentDate", currentDate(timezone).toString(),
                "userTimezone", timezone,
                "detectionType", request.triggeredBySlashCommand() ? "slash_command" : "natural_language",
                "conversationId", request.getConversationId() == null ? "none" : request.getConversationId()));
    }

    private LocalDate currentDate(String timezone) {
        try {
            return LocalDate.now(clock.withZone(ZoneId.of(timezone)));
        } catch (DateTimeException e) {
            log.warn("Unknown timezone '{}' for current date, using {}", timezone, defaultTimezone);
            return LocalDate.now(clock.withZone(ZoneId.of(defaultTimezone)));
        }
    }
}
