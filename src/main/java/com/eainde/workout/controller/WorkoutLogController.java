package com.eainde.workout.controller;

import com.eainde.workout.api.WorkoutLogRequest;
import com.eainde.workout.api.WorkoutLogResult;
import com.eainde.workout.service.WorkoutLoggerService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workouts")
@RequiredArgsConstructor
public class WorkoutLogController {

    private final WorkoutLoggerService workoutLoggerService;

    @PostMapping("/log")
    public WorkoutLogResult logWorkout(@RequestBody WorkoutLogRequest request) {
        return workoutLoggerService.logWorkout(request);
    }
}
