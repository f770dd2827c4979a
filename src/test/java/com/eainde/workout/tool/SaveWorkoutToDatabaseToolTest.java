package com.eainde.workout.tool;

import com.eainde.workout.agent.ExtractionRun;
import com.eainde.workout.api.TemplateContext;
import com.eainde.workout.api.WorkoutLogRequest;
import com.eainde.workout.error.PersistenceException;
import com.eainde.workout.error.PreconditionException;
import com.eainde.workout.persistence.DerivedRecordTrigger;
import com.eainde.workout.persistence.WorkoutPersistence;
import com.eainde.workout.persistence.WorkoutRecord;
import com.eainde.workout.store.ResultRole;
import com.eainde.workout.thread.MdcAwareExecutor;
import com.eainde.workout.tool.output.NormalizationOutcome;
import com.eainde.workout.tool.output.SaveOutcome;
import com.eainde.workout.tool.output.ValidationVerdict;
import com.eainde.workout.tool.output.WorkoutExtraction;
import com.eainde.workout.tool.output.WorkoutSummary;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.eainde.workout.WorkoutFixtures.COMPLETED_AT;
import static com.eainde.workout.WorkoutFixtures.json;
import static com.eainde.workout.WorkoutFixtures.powerliftingWorkout;
import static com.eainde.workout.WorkoutFixtures.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SaveWorkoutToDatabaseToolTest {

    private static final String WORKOUT_ID = "workout_user-1_1_abc";

    @Mock
    private WorkoutPersistence persistence;

    @Mock
    private DerivedRecordTrigger derivedRecordTrigger;

    @Mock
    private MdcAwareExecutor backgroundExecutor;

    private SaveWorkoutToDatabaseTool tool;

    @BeforeEach
    void setUp() {
        tool = new SaveWorkoutToDatabaseTool(persistence, derivedRecordTrigger, backgroundExecutor);
    }

    private static ExtractionRun completedRun(WorkoutLogRequest request) {
        ObjectNode workout = powerliftingWorkout();
        ExtractionRun run = new ExtractionRun(request);
        run.results().write(ResultRole.EXTRACTION,
                new WorkoutExtraction(workout, COMPLETED_AT, WorkoutExtraction.GENERATION_TOOL, "squats"), 0);
        run.results().write(ResultRole.VALIDATION, new ValidationVerdict(true, false, true, 0.8, 0.65,
                List.of(), List.of(), null, "ok", workout, COMPLETED_AT), 0);
        run.results().write(ResultRole.SUMMARY, new WorkoutSummary("Heavy lower day"), 0);
        return run;
    }

    private void runBackgroundTasksInline() {
        doAnswer(invocation -> {
            invocation.<Runnable>getArgument(1).run();
            return null;
        }).when(backgroundExecutor).runDetached(anyString(), any());
    }

    @Test
    void execute_shouldPersistRecord_andFireSideEffects() {
        // Arrange
        ExtractionRun run = completedRun(request("squats"));
        when(persistence.save(any())).thenReturn(WORKOUT_ID);
        runBackgroundTasksInline();

        // Act
        SaveOutcome outcome = (SaveOutcome) tool.execute(json("{'workoutIndex':0}"), run);

        // Assert
        assertThat(outcome.workoutId()).isEqualTo(WORKOUT_ID);
        assertThat(outcome.success()).isTrue();
        assertThat(outcome.templateLinked()).isFalse();

        ArgumentCaptor<WorkoutRecord> record = ArgumentCaptor.forClass(WorkoutRecord.class);
        verify(persistence).save(record.capture());
        assertThat(record.getValue().getWorkoutId()).isEqualTo(WORKOUT_ID);
        assertThat(record.getValue().getUserId()).isEqualTo("user-1");
        assertThat(record.getValue().getCoachIds()).isEqualTo("coach-1");
        assertThat(record.getValue().getDiscipline()).isEqualTo("powerlifting");
        assertThat(record.getValue().getSummary()).isEqualTo("Heavy lower day");
        assertThat(record.getValue().getCompletedAt()).isEqualTo(COMPLETED_AT);
        assertThat(record.getValue().getWorkoutJson()).contains("back squat");

        verify(persistence).indexForSearch(any(), eq("Heavy lower day"));
        verify(derivedRecordTrigger).trigger(eq(WORKOUT_ID), any());
        verify(persistence, never()).linkToTemplate(any(), any(), any(), any());
    }

    @Test
    void execute_shouldLinkProgramTemplate_whenRequestCarriesOne() {
        // Arrange
        WorkoutLogRequest request = request("squats");
        request.setTemplateContext(new TemplateContext("prog-1", "tpl-1", "grp-1"));
        ExtractionRun run = completedRun(request);
        when(persistence.save(any())).thenReturn(WORKOUT_ID);
        when(persistence.linkToTemplate("user-1", "tpl-1", "grp-1", WORKOUT_ID)).thenReturn(true);

        // Act
        SaveOutcome outcome = (SaveOutcome) tool.execute(json("{'workoutIndex':0}"), run);

        // Assert
        assertThat(outcome.templateLinked()).isTrue();
    }

    @Test
    void execute_shouldStillSucceed_whenTemplateLinkFails() {
        // Arrange
        WorkoutLogRequest request = request("squats");
        request.setTemplateContext(new TemplateContext("prog-1", "tpl-1", null));
        ExtractionRun run = completedRun(request);
        when(persistence.save(any())).thenReturn(WORKOUT_ID);
        when(persistence.linkToTemplate(any(), any(), any(), any())).thenThrow(new IllegalStateException("db"));

        // Act
        SaveOutcome outcome = (SaveOutcome) tool.execute(json("{'workoutIndex':0}"), run);

        // Assert
        assertThat(outcome.success()).isTrue();
        assertThat(outcome.templateLinked()).isFalse();
    }

    @Test
    void execute_shouldRequireSummary() {
        // Arrange
        ExtractionRun run = new ExtractionRun(request("squats"));
        ObjectNode workout = powerliftingWorkout();
        run.results().write(ResultRole.EXTRACTION, new WorkoutExtraction(workout, COMPLETED_AT, "tool", "s"), 0);
        run.results().write(ResultRole.VALIDATION, new ValidationVerdict(true, false, true, 0.8, 0.65,
                List.of(), List.of(), null, "ok", workout, COMPLETED_AT), 0);

        // Act & Assert
        assertThatThrownBy(() -> tool.execute(json("{'workoutIndex':0}"), run))
                .isInstanceOf(PreconditionException.class)
                .hasMessage(SaveWorkoutToDatabaseTool.MISSING_SUMMARY);
        verifyNoInteractions(persistence);
    }

    @Test
    void execute_shouldRefuse_whenNormalizationFoundDataInvalid() {
        // Arrange
        ExtractionRun run = completedRun(request("squats"));
        run.results().write(ResultRole.NORMALIZATION,
                new NormalizationOutcome(powerliftingWorkout(), false, 2, 0, "failed", 0.3), 0);

        // Act & Assert
        assertThatThrownBy(() -> tool.execute(json("{'workoutIndex':0}"), run))
                .isInstanceOf(PreconditionException.class)
                .hasMessageContaining("Confidence: 0.30, Issues: 2");
        verifyNoInteractions(persistence);
    }

    @Test
    void execute_shouldPropagatePersistenceFailure() {
        // Arrange
        ExtractionRun run = completedRun(request("squats"));
        when(persistence.save(any())).thenThrow(new PersistenceException("Failed to save workout", new RuntimeException()));

        // Act & Assert
        assertThatThrownBy(() -> tool.execute(json("{'workoutIndex':0}"), run))
                .isInstanceOf(PersistenceException.class);
        verifyNoInteractions(backgroundExecutor);
    }
}
