package com.eainde.workout.gate;

import com.eainde.workout.store.ResultRole;
import com.eainde.workout.store.ResultStore;
import com.eainde.workout.tool.ToolId;
import com.eainde.workout.tool.ToolInputs;
import com.eainde.workout.tool.output.ValidationVerdict;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Enforces validation decisions before normalize and save run. The model is told not to
 * call them after a blocked validation; this makes sure it cannot.
 */
@Slf4j
@Component
public class BlockingGate {

    public Optional<BlockDecision> check(ToolId toolId, JsonNode toolInput, ResultStore results) {
        String action;
        if (toolId == ToolId.NORMALIZE_WORKOUT_DATA) {
            action = "normalize";
        } else if (toolId == ToolId.SAVE_WORKOUT_TO_DATABASE) {
            action = "save";
        } else {
            return Optional.empty();
        }

        Integer index = ToolInputs.workoutIndex(toolInput);
        Optional<ValidationVerdict> verdict = results.read(ResultRole.VALIDATION, index, ValidationVerdict.class);
        if (verdict.isEmpty() || !verdict.get().blocksSave()) {
            return Optional.empty();
        }

        ValidationVerdict blocked = verdict.get();
        log.warn("Blocking {} for workoutIndex {}: {} {}", toolId.toolName(), index, blocked.reason(),
                blocked.blockingFlags());
        return Optional.of(new BlockDecision(
                "Cannot " + action + " workout - validation blocked save: " + blocked.reason(),
                blocked.blockingFlags()));
    }
}
