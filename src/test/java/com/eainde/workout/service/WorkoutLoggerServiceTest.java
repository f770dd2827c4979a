package com.eainde.workout.service;

import com.eainde.workout.agent.ConversationOutcome;
import com.eainde.workout.agent.ExtractionRun;
import com.eainde.workout.agent.ResultAssembler;
import com.eainde.workout.agent.WorkoutLoggerAgent;
import com.eainde.workout.api.WorkoutLogResult;
import com.eainde.workout.prompt.PromptLoader;
import com.eainde.workout.retry.RetryPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;

import static com.eainde.workout.WorkoutFixtures.request;
import static com.eainde.workout.WorkoutFixtures.slashRequest;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkoutLoggerServiceTest {

    private static final String QUESTION = "How many rounds did you do?";
    private static final WorkoutLogResult INCOMPLETE = WorkoutLogResult.skipped("Workflow incomplete");
    private static final WorkoutLogResult SAVED = WorkoutLogResult.saved(List.of(
            WorkoutLogResult.SavedWorkout.of(0, "workout_user-1_1_abc", "crossfit", 0.9, 0.7)));

    @Mock
    private WorkoutLoggerAgent agent;

    @Mock
    private ResultAssembler resultAssembler;

    @Mock
    private RetryPolicy retryPolicy;

    private WorkoutLoggerService service;

    @BeforeEach
    void setUp() {
        service = new WorkoutLoggerService(agent, resultAssembler, retryPolicy, new PromptLoader(), true);
    }

    @Test
    void logWorkout_shouldSkipBlankMessage_withoutCallingModel() {
        WorkoutLogResult result = service.logWorkout(request("   "));

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getReason()).isEqualTo("No workout data provided");
        verifyNoInteractions(agent);
    }

    @Test
    void logWorkout_shouldReturnFirstResult_whenNoRetryIsNeeded() {
        // Arrange
        when(agent.converse(any(), eq("Fran in 7:00"))).thenReturn(new ConversationOutcome("Logged.", 6, false));
        when(resultAssembler.buildResult(any(), eq("Logged."))).thenReturn(SAVED);
        when(retryPolicy.shouldRetry(eq(SAVED), eq("Logged."), any())).thenReturn(false);

        // Act
        WorkoutLogResult result = service.logWorkout(request("Fran in 7:00"));

        // Assert
        assertThat(result).isSameAs(SAVED);
        verify(agent, times(1)).converse(any(), anyString());
    }

    @Test
    void logWorkout_shouldRetryOnceWithDirective_andKeepTheSavedResult() {
        // Arrange
        when(agent.converse(any(), eq("Fran in 7:00"))).thenReturn(new ConversationOutcome(QUESTION, 1, false));
        when(agent.converse(any(), contains("CRITICAL OVERRIDE"))).thenReturn(new ConversationOutcome("Logged.", 6, false));
        when(resultAssembler.buildResult(any(), eq(QUESTION))).thenReturn(INCOMPLETE);
        when(resultAssembler.buildResult(any(), eq("Logged."))).thenReturn(SAVED);
        when(retryPolicy.shouldRetry(eq(INCOMPLETE), eq(QUESTION), any())).thenReturn(true);

        // Act
        WorkoutLogResult result = service.logWorkout(request("Fran in 7:00"));

        // Assert
        assertThat(result).isSameAs(SAVED);
        verify(agent).converse(any(), contains("Original message to process:\nFran in 7:00"));
    }

    @Test
    void logWorkout_shouldKeepOriginalResult_whenRetryAlsoFails() {
        // Arrange
        WorkoutLogResult stillIncomplete = WorkoutLogResult.skipped("still nothing");
        when(agent.converse(any(), eq("Fran"))).thenReturn(new ConversationOutcome(QUESTION, 1, false));
        when(agent.converse(any(), contains("CRITICAL OVERRIDE"))).thenReturn(new ConversationOutcome("Hmm?", 1, false));
        when(resultAssembler.buildResult(any(), eq(QUESTION))).thenReturn(INCOMPLETE);
        when(resultAssembler.buildResult(any(), eq("Hmm?"))).thenReturn(stillIncomplete);
        when(retryPolicy.shouldRetry(eq(INCOMPLETE), eq(QUESTION), any())).thenReturn(true);

        // Act
        WorkoutLogResult result = service.logWorkout(request("Fran"));

        // Assert
        assertThat(result).isSameAs(INCOMPLETE);
        verify(retryPolicy, times(1)).shouldRetry(any(), any(), any());
    }

    @Test
    void logWorkout_shouldPrefixSlashCommand() {
        // Arrange
        when(agent.converse(any(), eq("/log-workout bench 3x5"))).thenReturn(new ConversationOutcome("ok", 6, false));
        when(resultAssembler.buildResult(any(), eq("ok"))).thenReturn(SAVED);

        // Act
        service.logWorkout(slashRequest("bench 3x5"));

        // Assert
        verify(agent).converse(any(ExtractionRun.class), eq("/log-workout bench 3x5"));
    }

    @Test
    void logWorkout_shouldNeverThrow_andClearMdc() {
        // Arrange
        when(agent.converse(any(), anyString())).thenThrow(new IllegalStateException("model unavailable"));

        // Act
        WorkoutLogResult result = service.logWorkout(request("Fran"));

        // Assert
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isEqualTo("model unavailable");
        assertThat(MDC.get("runId")).isNull();
        verify(retryPolicy, never()).shouldRetry(any(), any(), any());
    }
}
