package com.eainde.workout.persistence;

import com.eainde.workout.error.PersistenceException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaWorkoutPersistence implements WorkoutPersistence {

    private final WorkoutRecordRepository repository;
    private final WorkoutSearchIndexer searchIndexer;

    @Override
    public String save(WorkoutRecord record) {
        try {
            WorkoutRecord saved = repository.save(record);
            log.info("Saved workout {} for user {}", saved.getWorkoutId(), saved.getUserId());
            return saved.getWorkoutId();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to save workout " + record.getWorkoutId(), e);
        }
    }

    @Override
    public void indexForSearch(ObjectNode workout, String summary) {
        searchIndexer.index(workout, summary);
    }

    @Override
    public boolean linkToTemplate(String userId, String templateId, String groupId, String workoutId) {
        // Program storage lives outside this service; the link is recorded on the workout row.
        return repository.findById(workoutId)
                .map(record -> {
                    record.setTemplateId(templateId);
                    record.setGroupId(groupId);
                    repository.save(record);
                    log.info("Linked workout {} to template {} (group {}) for user {}",
                            workoutId, templateId, groupId, userId);
                    return true;
                })
                .orElseGet(() -> {
                    log.warn("Cannot link template {}: workout {} not found", templateId, workoutId);
                    return false;
                });
    }
}
