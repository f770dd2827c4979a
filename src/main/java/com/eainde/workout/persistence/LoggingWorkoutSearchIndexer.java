package com.eainde.workout.persistence;

import com.eainde.workout.workout.WorkoutFields;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default indexer used when no vector store is wired in. Records what would have been indexed.
 */
@Slf4j
@Component
public class LoggingWorkoutSearchIndexer implements WorkoutSearchIndexer {

    @Override
    public void index(ObjectNode workout, String summary) {
        log.info("Indexing workout {} ({}) for search, summary length {}",
                WorkoutFields.text(workout, "workout_id"), WorkoutFields.discipline(workout),
                summary == null ? 0 : summary.length());
    }
}
