package com.eainde.workout.service;

import com.eainde.workout.agent.ConversationOutcome;
import com.eainde.workout.agent.ExtractionRun;
import com.eainde.workout.agent.ResultAssembler;
import com.eainde.workout.agent.WorkoutLoggerAgent;
import com.eainde.workout.api.WorkoutLogRequest;
import com.eainde.workout.api.WorkoutLogResult;
import com.eainde.workout.prompt.PromptLoader;
import com.eainde.workout.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Entry point for logging one user message.
 *
 * For each request:
 *   1. Put the run identifiers into the MDC
 *   2. Converse with the model until it stops calling tools
 *   3. Build the result from the run's result store
 *   4. Retry once with a stricter prompt if the model asked questions instead of working
 *
 * Never throws: any failure becomes a skipped result with the reason.
 */
@Service
public class WorkoutLoggerService {

    private static final Logger log = LoggerFactory.getLogger(WorkoutLoggerService.class);

    static final String MDC_RUN_ID = "runId";
    static final String MDC_USER_ID = "userId";
    static final String MDC_CONVERSATION_ID = "conversationId";

    private final WorkoutLoggerAgent agent;
    private final ResultAssembler resultAssembler;
    private final RetryPolicy retryPolicy;
    private final PromptLoader promptLoader;
    private final boolean retryEnabled;

    public WorkoutLoggerService(WorkoutLoggerAgent agent,
                                ResultAssembler resultAssembler,
                                RetryPolicy retryPolicy,
                                PromptLoader promptLoader,
                                @Value("${workout-logger.agent.retry-enabled:true}") boolean retryEnabled) {
        this.agent = agent;
        this.resultAssembler = resultAssembler;
        this.retryPolicy = retryPolicy;
        this.promptLoader = promptLoader;
        this.retryEnabled = retryEnabled;
    }

    public WorkoutLogResult logWorkout(WorkoutLogRequest request) {
        if (request.getUserMessage() == null || request.getUserMessage().isBlank()) {
            log.warn("Empty workout message for user {}", request.getUserId());
            return WorkoutLogResult.skipped("No workout data provided");
        }

        ExtractionRun run = new ExtractionRun(request);
        MDC.put(MDC_RUN_ID, run.runId());
        putIfPresent(MDC_USER_ID, request.getUserId());
        putIfPresent(MDC_CONVERSATION_ID, request.getConversationId());
        try {
            log.info("Starting workout logging for user {} (slashCommand={})",
                    request.getUserId(), request.triggeredBySlashCommand());

            // Step 1: Converse
            ConversationOutcome outcome = agent.converse(run, buildUserMessage(request));

            // Step 2: Build result
            WorkoutLogResult result = resultAssembler.buildResult(run, outcome.finalText());

            // Step 3: One retry if the model stalled
            if (retryEnabled && retryPolicy.shouldRetry(result, outcome.finalText(), run.results())) {
                String directive = promptLoader.render("retry-directive",
                        Map.of("originalMessage", request.getUserMessage()));
                ConversationOutcome retryOutcome = agent.converse(run, directive);
                WorkoutLogResult retried = resultAssembler.buildResult(run, retryOutcome.finalText());

                if (!retried.isSuccess() && retried.isSkipped()) {
                    log.warn("Retry did not save a workout, returning original result");
                } else {
                    result = retried;
                }
            }

            log.info("Workout logging finished: {} ({} tool calls)", result, run.toolCallCount());
            return result;
        } catch (Exception e) {
            log.error("Workout logging failed for user {}", request.getUserId(), e);
            return WorkoutLogResult.skipped(e.getMessage() != null ? e.getMessage() : "Unknown error occurred");
        } finally {
            MDC.remove(MDC_RUN_ID);
            MDC.remove(MDC_USER_ID);
            MDC.remove(MDC_CONVERSATION_ID);
        }
    }

    private static String buildUserMessage(WorkoutLogRequest request) {
        if (!request.triggeredBySlashCommand()) {
            return request.getUserMessage();
        }
        return "/" + request.getSlashCommand() + " " + request.getUserMessage();
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
