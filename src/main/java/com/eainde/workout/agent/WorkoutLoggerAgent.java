package com.eainde.workout.agent;

import com.eainde.workout.gate.BlockDecision;
import com.eainde.workout.gate.BlockingGate;
import com.eainde.workout.repair.ResponseRepair;
import com.eainde.workout.store.ResultRole;
import com.eainde.workout.store.ResultStore;
import com.eainde.workout.tool.ToolInputs;
import com.eainde.workout.tool.ToolRegistry;
import com.eainde.workout.tool.WorkoutTool;
import com.eainde.workout.tool.output.ToolFailure;
import com.eainde.workout.tool.output.ToolOutput;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The tool-calling loop. Sends the conversation to the model, runs the tools it asks for
 * one at a time, feeds the results back, and stops when the model answers with text.
 *
 * <p>Every tool call passes the {@link BlockingGate}; normalize and save cannot run for a
 * workout that validation refused. Tool exceptions never escape: they are stored as
 * {@link ToolFailure}s and reported to the model as error results.</p>
 */
@Slf4j
@Component
public class WorkoutLoggerAgent {

    static final String STATUS_SUCCESS = "success";
    static final String STATUS_ERROR = "error";

    private final ChatModel chatModel;
    private final ToolRegistry toolRegistry;
    private final BlockingGate blockingGate;
    private final SystemPromptBuilder systemPromptBuilder;
    private final ObjectMapper objectMapper;
    private final int maxIterations;
    private final int maxWorkoutIndex;

    public WorkoutLoggerAgent(ChatModel chatModel,
                              ToolRegistry toolRegistry,
                              BlockingGate blockingGate,
                              SystemPromptBuilder systemPromptBuilder,
                              ObjectMapper objectMapper,
                              @Value("${workout-logger.agent.max-iterations:20}") int maxIterations) {
        this.chatModel = chatModel;
        this.toolRegistry = toolRegistry;
        this.blockingGate = blockingGate;
        this.systemPromptBuilder = systemPromptBuilder;
        this.objectMapper = objectMapper;
        this.maxIterations = maxIterations;
        // Each workout takes several tool calls, so a run cannot reach more indexes than iterations
        this.maxWorkoutIndex = Math.max(0, Math.min(maxIterations - 1, ResultStore.MAX_WORKOUT_INDEX));
    }

    /**
     * Adds {@code userText} to the run's history and converses until the model stops calling tools.
     */
    public ConversationOutcome converse(ExtractionRun run, String userText) {
        run.append(UserMessage.from(userText));
        SystemMessage systemMessage = SystemMessage.from(systemPromptBuilder.build(run.request()));
        ChatRequestParameters parameters = ChatRequestParameters.builder()
                .toolSpecifications(toolRegistry.specifications())
                .build();

        String lastText = null;
        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            log.info("Agent iteration {}/{}", iteration, maxIterations);

            List<ChatMessage> messages = new ArrayList<>();
            messages.add(systemMessage);
            messages.addAll(run.history());
            ChatResponse response = chatModel.chat(ChatRequest.builder()
                    .messages(messages)
                    .parameters(parameters)
                    .build());

            AiMessage reply = response.aiMessage();
            run.append(reply);
            if (reply.text() != null && !reply.text().isBlank()) {
                lastText = reply.text();
            }

            if (!reply.hasToolExecutionRequests()) {
                log.info("Model finished after {} iteration(s), {} tool call(s)", iteration, run.toolCallCount());
                return new ConversationOutcome(reply.text(), iteration, false);
            }

            for (ToolExecutionRequest request : reply.toolExecutionRequests()) {
                String resultText = dispatch(request, run);
                run.append(ToolExecutionResultMessage.from(request, resultText));
            }
        }

        log.warn("Reached iteration limit of {} without a final response", maxIterations);
        return new ConversationOutcome(lastText, maxIterations, true);
    }

    /**
     * Runs one tool request and returns the JSON text sent back to the model.
     */
    String dispatch(ToolExecutionRequest request, ExtractionRun run) {
        run.recordToolCall();
        String toolName = request.name();

        Optional<WorkoutTool> found = toolRegistry.find(toolName);
        if (found.isEmpty()) {
            log.warn("Model requested unknown tool {}", toolName);
            return error("Tool not found: " + toolName);
        }
        WorkoutTool tool = found.get();
        ResultRole role = tool.id().role();

        JsonNode input;
        try {
            input = parseArguments(request.arguments());
        } catch (RuntimeException e) {
            log.error("Unparseable arguments for {}: {}", toolName, e.getMessage());
            run.results().write(role, ToolFailure.of("Invalid tool arguments: " + e.getMessage()));
            return error("Invalid tool arguments: " + e.getMessage());
        }

        Integer index = ToolInputs.workoutIndex(input);
        if (index != null && (index < 0 || index > maxWorkoutIndex)) {
            log.warn("Rejected {} call with workoutIndex {} (allowed 0..{})", toolName, index, maxWorkoutIndex);
            return error("workoutIndex must be between 0 and " + maxWorkoutIndex);
        }

        Optional<BlockDecision> block = blockingGate.check(tool.id(), input, run.results());
        if (block.isPresent()) {
            BlockDecision decision = block.get();
            ToolFailure failure = ToolFailure.blocked(decision.reason(), decision.reason(), decision.blockingFlags());
            run.results().write(role, failure, index);
            return toJson(STATUS_ERROR, failure);
        }

        log.info("Executing tool {} (workoutIndex={})", toolName, index);
        try {
            ToolOutput output = tool.execute(input, run);
            run.results().write(role, output, index);
            log.info("Tool {} completed", toolName);
            return toJson(STATUS_SUCCESS, output);
        } catch (RuntimeException e) {
            log.error("Tool {} failed: {}", toolName, e.getMessage(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            ToolFailure failure = ToolFailure.of(message);
            run.results().write(role, failure, index);
            return toJson(STATUS_ERROR, failure);
        }
    }

    private JsonNode parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        return ResponseRepair.parseTrustedJson(arguments);
    }

    private String toJson(String status, ToolOutput output) {
        ObjectNode payload = objectMapper.valueToTree(output);
        payload.put("status", status);
        return payload.toString();
    }

    private String error(String message) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("status", STATUS_ERROR);
        payload.put("error", message);
        return payload.toString();
    }
}
