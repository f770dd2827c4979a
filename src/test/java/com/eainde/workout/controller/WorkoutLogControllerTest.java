package com.eainde.workout.controller;

import com.eainde.workout.api.WorkoutLogRequest;
import com.eainde.workout.api.WorkoutLogResult;
import com.eainde.workout.service.WorkoutLoggerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class WorkoutLogControllerTest {

    @Mock
    private WorkoutLoggerService service;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new WorkoutLogController(service)).build();
    }

    @Test
    void logWorkout_shouldBindRequest_andReturnResult() throws Exception {
        // Arrange
        when(service.logWorkout(any())).thenReturn(WorkoutLogResult.saved(List.of(
                WorkoutLogResult.SavedWorkout.of(0, "workout_user-1_1_abc", "running", 0.9, 0.65))));

        // Act & Assert
        mockMvc.perform(post("/api/workouts/log")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"user-1\",\"userMessage\":\"5k in 24 min\","
                                + "\"userTimezone\":\"Europe/London\",\"slashCommand\":\"log-workout\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.workoutId").value("workout_user-1_1_abc"))
                .andExpect(jsonPath("$.allWorkouts[0].discipline").value("running"))
                .andExpect(jsonPath("$.reason").doesNotExist());

        ArgumentCaptor<WorkoutLogRequest> request = ArgumentCaptor.forClass(WorkoutLogRequest.class);
        verify(service).logWorkout(request.capture());
        assertThat(request.getValue().getUserTimezone()).isEqualTo("Europe/London");
        assertThat(request.getValue().triggeredBySlashCommand()).isTrue();
    }
}
