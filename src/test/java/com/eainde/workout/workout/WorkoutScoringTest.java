package com.eainde.workout.workout;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.eainde.workout.WorkoutFixtures.object;
import static com.eainde.workout.WorkoutFixtures.powerliftingWorkout;
import static com.eainde.workout.WorkoutFixtures.reflection;
import static org.assertj.core.api.Assertions.assertThat;

class WorkoutScoringTest {

    @Nested
    @DisplayName("calculateConfidence")
    class Confidence {

        @Test
        void calculateConfidence_shouldClampToOne_whenEverySignalIsPresent() {
            // Arrange
            ObjectNode workout = object("{'workout_name':'Fran','discipline_specific':{'crossfit':{'performance_data':{'total_time':420}}},"
                    + "'performance_metrics':{'perceived_exertion':9},'coach_notes':'fast',"
                    + "'metadata':{'validation_flags':[]}}");

            // Act & Assert
            assertThat(WorkoutScoring.calculateConfidence(workout)).isEqualTo(1.0);
        }

        @Test
        void calculateConfidence_shouldAddCrossfitBonus_whenPerformanceDataHasTotalTime() {
            // Arrange
            ObjectNode workout = object("{'discipline_specific':{'crossfit':{'performance_data':{'total_time':420}}}}");

            // Act & Assert
            assertThat(WorkoutScoring.calculateConfidence(workout)).isEqualTo(0.7);
        }

        @Test
        void calculateConfidence_shouldIgnoreTotalTime_outsidePerformanceData() {
            // Arrange
            ObjectNode workout = object("{'discipline_specific':{'crossfit':{'total_time':420}}}");

            // Act & Assert
            assertThat(WorkoutScoring.calculateConfidence(workout)).isEqualTo(0.5);
        }

        @Test
        void calculateConfidence_shouldSubtractPerValidationFlag() {
            // Arrange
            ObjectNode workout = object("{'metadata':{'validation_flags':['a','b','c']}}");

            // Act & Assert
            assertThat(WorkoutScoring.calculateConfidence(workout)).isEqualTo(0.35);
        }

        @Test
        void calculateConfidence_shouldNeverDropBelowFloor() {
            // Arrange
            ObjectNode workout = object("{'metadata':{'validation_flags':['1','2','3','4','5','6','7','8','9','10','11']}}");

            // Act & Assert
            assertThat(WorkoutScoring.calculateConfidence(workout)).isEqualTo(0.1);
        }
    }

    @Nested
    @DisplayName("calculateCompleteness")
    class Completeness {

        @Test
        void calculateCompleteness_shouldWeightStructuredWork() {
            // name 0.1 + duration 0.15 + exercises 0.4
            assertThat(WorkoutScoring.calculateCompleteness(powerliftingWorkout())).isEqualTo(0.65);
        }

        @Test
        void calculateCompleteness_shouldStayBelowFloor_forReflection() {
            assertThat(WorkoutScoring.calculateCompleteness(reflection())).isLessThan(0.2);
        }

        @Test
        void calculateCompleteness_shouldCountDisciplineDataFiledUnderAnotherKey() {
            // Arrange
            ObjectNode workout = object("{'discipline':'crossfit',"
                    + "'discipline_specific':{'hybrid':{'phases':[{'phase_type':'main'}]}}}");

            // Act & Assert
            assertThat(WorkoutScoring.calculateCompleteness(workout)).isEqualTo(0.4);
        }
    }
}
