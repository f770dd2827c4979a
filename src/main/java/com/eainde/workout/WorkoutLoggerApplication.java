package com.eainde.workout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkoutLoggerApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkoutLoggerApplication.class, args);
    }
}
