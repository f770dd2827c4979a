package com.eainde.workout.persistence;

import com.fasterxml.jackson.databind.node.ObjectNode;

public interface WorkoutSearchIndexer {

    void index(ObjectNode workout, String summary);
}
