package com.eainde.workout.agent;

import com.eainde.workout.api.WorkoutLogRequest;
import com.eainde.workout.store.ResultStore;
import dev.langchain4j.data.message.ChatMessage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * State of one logging request: the conversation with the model and the tool results.
 * Created per request and never shared, so nothing in it needs synchronisation.
 */
public class ExtractionRun {

    private final String runId;
    private final WorkoutLogRequest request;
    private final Instant startedAt;
    private final ResultStore results = new ResultStore();
    private final List<ChatMessage> history = new ArrayList<>();
    private int toolCallCount;

    public ExtractionRun(WorkoutLogRequest request) {
        this(UUID.randomUUID().toString(), request, Instant.now());
    }

    public ExtractionRun(String runId, WorkoutLogRequest request, Instant startedAt) {
        this.runId = runId;
        this.request = request;
        this.startedAt = startedAt;
    }

    public String runId() {
        return runId;
    }

    public WorkoutLogRequest request() {
        return request;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public ResultStore results() {
        return results;
    }

    public List<ChatMessage> history() {
        return Collections.unmodifiableList(history);
    }

    void append(ChatMessage message) {
        history.add(message);
    }

    void recordToolCall() {
        toolCallCount++;
    }

    public int toolCallCount() {
        return toolCallCount;
    }
}
