package com.eainde.workout.persistence;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Kicks off downstream processing of a saved workout, e.g. per-exercise history records.
 */
public interface DerivedRecordTrigger {

    void trigger(String workoutId, ObjectNode workout);
}
