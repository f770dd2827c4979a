package com.eainde.workout.persistence;

import com.eainde.workout.error.PersistenceException;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Storage boundary for logged workouts.
 */
public interface WorkoutPersistence {

    /**
     * @return the id the workout was stored under
     * @throws PersistenceException when the record could not be written
     */
    String save(WorkoutRecord record);

    /**
     * Makes the workout findable by semantic search. Called off the request thread.
     */
    void indexForSearch(ObjectNode workout, String summary);

    /**
     * Marks the program template as completed by this workout.
     *
     * @return false when the template could not be linked
     */
    boolean linkToTemplate(String userId, String templateId, String groupId, String workoutId);
}
