package com.eainde.workout.model;

import com.eainde.workout.error.MalformedResponseException;
import com.eainde.workout.repair.ResponseRepair;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.ToolChoice;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Single-shot model calls made from inside tools (classification, extraction,
 * normalization, summaries). The conversational loop talks to the model directly.
 *
 * <p>Every structured answer goes through {@link ResponseRepair} before it is returned,
 * so callers only ever see parsed JSON or a {@link MalformedResponseException}.</p>
 */
@Slf4j
@Component
public class StructuredModelClient {

    private final ChatModel chatModel;
    private final double temperature;

    public StructuredModelClient(ChatModel chatModel,
                                 @Value("${workout-logger.model.structured-temperature:0.2}") double temperature) {
        this.chatModel = chatModel;
        this.temperature = temperature;
    }

    /**
     * Forces the model to answer through {@code tool} and returns the repaired arguments.
     *
     * @param purpose short label used in logs, e.g. {@code discipline_detection}
     * @throws MalformedResponseException if the model answered without calling the tool
     *                                    or the arguments could not be repaired
     */
    public JsonNode callTool(String purpose, String systemPrompt, String userPrompt, ToolSpecification tool) {
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt)))
                .parameters(ChatRequestParameters.builder()
                        .temperature(temperature)
                        .toolSpecifications(List.of(tool))
                        .toolChoice(ToolChoice.REQUIRED)
                        .build())
                .build();

        AiMessage reply = send(purpose, request);
        if (!reply.hasToolExecutionRequests()) {
            throw new MalformedResponseException("Model did not call " + tool.name() + " for " + purpose);
        }

        ToolExecutionRequest call = reply.toolExecutionRequests().stream()
                .filter(r -> tool.name().equals(r.name()))
                .findFirst()
                .orElseThrow(() -> new MalformedResponseException(
                        "Model called an unexpected tool for " + purpose));

        log.debug("[{}] tool {} returned {} chars of arguments", purpose, call.name(),
                call.arguments() == null ? 0 : call.arguments().length());
        return ResponseRepair.parseTrustedJson(call.arguments());
    }

    /**
     * Asks for a JSON document as plain text and repairs it.
     */
    public JsonNode callJson(String purpose, String systemPrompt, String userPrompt) {
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt)))
                .parameters(ChatRequestParameters.builder()
                        .temperature(temperature)
                        .responseFormat(ResponseFormat.builder()
                                .type(ResponseFormatType.JSON)
                                .build())
                        .build())
                .build();

        AiMessage reply = send(purpose, request);
        return ResponseRepair.parseTrustedJson(reply.text());
    }

    public String callText(String purpose, String systemPrompt, String userPrompt) {
        ChatRequest request = ChatRequest.builder()
                .messages(List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt)))
                .parameters(ChatRequestParameters.builder()
                        .temperature(temperature)
                        .build())
                .build();

        String text = send(purpose, request).text();
        if (text == null || text.isBlank()) {
            throw new MalformedResponseException("Model returned no text for " + purpose);
        }
        return text.trim();
    }

    private AiMessage send(String purpose, ChatRequest request) {
        long start = System.currentTimeMillis();
        ChatResponse response = chatModel.chat(request);
        log.debug("[{}] model call took {}ms, finishReason={}", purpose,
                System.currentTimeMillis() - start, response.finishReason());
        if (response.aiMessage() == null) {
            throw new MalformedResponseException("Model returned no message for " + purpose);
        }
        return response.aiMessage();
    }
}
