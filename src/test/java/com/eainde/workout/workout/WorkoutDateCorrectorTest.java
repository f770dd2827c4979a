package com.eainde.workout.workout;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static com.eainde.workout.WorkoutFixtures.CLOCK;
import static com.eainde.workout.WorkoutFixtures.object;
import static org.assertj.core.api.Assertions.assertThat;

class WorkoutDateCorrectorTest {

    @Test
    void correct_shouldReplaceHallucinatedYear_withCompletionDate() {
        // GIVEN a model that wrote a year from its training data
        ObjectNode workout = object("{'date':'2023-10-17','metadata':{'validation_flags':[]}}");

        // WHEN
        boolean corrected = WorkoutDateCorrector.correct(workout, "2026-10-17T18:00-07:00", CLOCK);

        // THEN
        assertThat(corrected).isTrue();
        assertThat(workout.path("date").asText()).isEqualTo("2026-10-17");
        assertThat(WorkoutFields.validationFlagList(workout)).containsExactly("date");
    }

    @Test
    void correct_shouldKeepDate_whenYearIsPlausible() {
        // GIVEN
        ObjectNode workout = object("{'date':'2025-12-31'}");

        // WHEN
        boolean corrected = WorkoutDateCorrector.correct(workout, "2026-01-01T09:00-08:00", CLOCK);

        // THEN
        assertThat(corrected).isFalse();
        assertThat(workout.path("date").asText()).isEqualTo("2025-12-31");
        assertThat(workout.has("metadata")).isFalse();
    }

    @Test
    void correct_shouldDoNothing_whenDateIsMissingOrUnparseable() {
        assertThat(WorkoutDateCorrector.correct(object("{}"), "2026-10-17T18:00-07:00", CLOCK)).isFalse();
        assertThat(WorkoutDateCorrector.correct(object("{'date':'last tuesday'}"), "2026-10-17T18:00-07:00", CLOCK))
                .isFalse();
    }
}
