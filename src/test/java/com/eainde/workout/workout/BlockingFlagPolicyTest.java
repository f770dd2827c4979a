package com.eainde.workout.workout;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BlockingFlagPolicyTest {

    private static final List<String> FLAGS = List.of("date", "no_performance_data", "planning_inquiry");

    @Test
    void detect_shouldBlockNothing_forSlashCommands() {
        assertThat(BlockingFlagPolicy.detect(FLAGS, true, false)).isEmpty();
    }

    @Test
    void detect_shouldIgnoreMissingPerformanceData_forQualitativeWorkouts() {
        assertThat(BlockingFlagPolicy.detect(FLAGS, false, true)).containsExactly("planning_inquiry");
    }

    @Test
    void detect_shouldReturnEveryBlockingFlag_forQuantitativeWorkouts() {
        assertThat(BlockingFlagPolicy.detect(FLAGS, false, false))
                .containsExactly("no_performance_data", "planning_inquiry");
    }

    @Test
    void reason_shouldExplainMissingPerformanceData_forStrengthWork() {
        assertThat(BlockingFlagPolicy.reason(List.of("no_performance_data"), false, false))
                .isEqualTo("No performance data found for strength/power workout");
    }

    @Test
    void reason_shouldDescribePlanning_otherwise() {
        assertThat(BlockingFlagPolicy.reason(List.of("advice_seeking"), false, true))
                .isEqualTo("Not a workout log - appears to be planning/advice seeking");
    }
}
