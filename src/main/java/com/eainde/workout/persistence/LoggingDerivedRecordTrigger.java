package com.eainde.workout.persistence;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingDerivedRecordTrigger implements DerivedRecordTrigger {

    @Override
    public void trigger(String workoutId, ObjectNode workout) {
        log.info("Derived record processing requested for workout {}", workoutId);
    }
}
