package com.eainde.workout.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@Entity
@Table(name = "WORKOUT_LOG")
public class WorkoutRecord {
    @Id
    private String workoutId;       // workout_<userId>_<epochMillis>_<shortId>
    private String userId;
    private String coachIds;        // comma separated
    private String conversationId;
    private String discipline;      // e.g. "crossfit", "powerlifting"
    private String workoutName;
    private String completedAt;     // ISO-8601 with the user's offset

    @Column(length = 4000)
    private String summary;

    private Double confidence;
    private Double completeness;
    private String generationMethod; // "tool" or "fallback"
    private String templateId;
    private String groupId;

    @Lob
    private String workoutJson;

    private LocalDateTime createdAt;

    public WorkoutRecord() {}
    public WorkoutRecord(String workoutId, String userId, String discipline) {
        this.workoutId = workoutId;
        this.userId = userId;
        this.discipline = discipline;
        this.createdAt = LocalDateTime.now();
    }
}
