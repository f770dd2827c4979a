package com.eainde.workout.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WorkoutRecordRepository extends JpaRepository<WorkoutRecord, String> {

    List<WorkoutRecord> findByUserIdOrderByCompletedAtDesc(String userId);
}
