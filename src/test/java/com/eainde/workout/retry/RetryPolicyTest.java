package com.eainde.workout.retry;

import com.eainde.workout.api.WorkoutLogResult;
import com.eainde.workout.store.ResultRole;
import com.eainde.workout.store.ResultStore;
import com.eainde.workout.tool.output.DisciplineDetection;
import com.eainde.workout.tool.output.ToolFailure;
import com.eainde.workout.tool.output.ValidationVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private static final String QUESTION = "How many rounds did you complete?";
    private static final String NOT_SAVED = "Workflow incomplete";

    private RetryPolicy policy;
    private ResultStore results;

    @BeforeEach
    void setUp() {
        policy = new RetryPolicy(new ValidRefusalClassifier(), new IncompleteWorkflowClassifier());
        results = new ResultStore();
    }

    @Test
    void shouldRetry_shouldBeTrue_whenNoToolRanAndModelAskedQuestion() {
        assertThat(policy.shouldRetry(WorkoutLogResult.skipped(NOT_SAVED), QUESTION, results)).isTrue();
    }

    @Test
    void shouldRetry_shouldBeTrue_whenOnlyFailuresWereStored() {
        // Arrange
        results.write(ResultRole.DISCIPLINE, ToolFailure.of("timeout"));

        // Act & Assert
        assertThat(policy.shouldRetry(WorkoutLogResult.skipped(NOT_SAVED), QUESTION, results)).isTrue();
    }

    @Test
    void shouldRetry_shouldBeFalse_whenAnyToolSucceeded() {
        // Arrange
        results.write(ResultRole.DISCIPLINE, new DisciplineDetection("running", 0.9, DisciplineDetection.METHOD_AI, "5k"));

        // Act & Assert
        assertThat(policy.shouldRetry(WorkoutLogResult.skipped(NOT_SAVED), QUESTION, results)).isFalse();
    }

    @Test
    void shouldRetry_shouldBeFalse_whenResultCarriesBlockingFlags() {
        WorkoutLogResult blocked = WorkoutLogResult.blocked("planning", List.of("planning_inquiry"), 0.4);

        assertThat(policy.shouldRetry(blocked, QUESTION, results)).isFalse();
    }

    @Test
    void shouldRetry_shouldBeFalse_whenStoredVerdictHasBlockingFlags() {
        // Arrange
        results.write(ResultRole.VALIDATION, new ValidationVerdict(false, false, false, 0.4, 0.1, List.of(),
                List.of("insufficient_data"), null, "reflection", null, null));

        // Act & Assert
        assertThat(policy.shouldRetry(WorkoutLogResult.skipped(NOT_SAVED), QUESTION, results)).isFalse();
    }

    @Test
    void shouldRetry_shouldBeFalse_whenModelCorrectlyRefused() {
        String refusal = "This is a planning question, can you confirm when you'll do it?";

        assertThat(policy.shouldRetry(WorkoutLogResult.skipped(NOT_SAVED), refusal, results)).isFalse();
    }

    @Test
    void shouldRetry_shouldBeFalse_whenResponseIsNotARequestForInput() {
        assertThat(policy.shouldRetry(WorkoutLogResult.skipped(NOT_SAVED), "Done.", results)).isFalse();
    }

    @Test
    void shouldRetry_shouldBeFalse_whenRunSucceeded() {
        WorkoutLogResult saved = WorkoutLogResult.saved(List.of(
                WorkoutLogResult.SavedWorkout.of(0, "workout_u_1_abc", "running", 0.9, 0.7)));

        assertThat(policy.shouldRetry(saved, QUESTION, results)).isFalse();
    }
}
