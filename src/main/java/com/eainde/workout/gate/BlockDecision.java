package com.eainde.workout.gate;

import java.util.List;

/**
 * Why a normalize or save call was refused. A value, not an exception: the agent
 * turns it into a tool error result.
 */
public record BlockDecision(String reason, List<String> blockingFlags) {

    public BlockDecision {
        blockingFlags = blockingFlags == null ? List.of() : List.copyOf(blockingFlags);
    }
}
