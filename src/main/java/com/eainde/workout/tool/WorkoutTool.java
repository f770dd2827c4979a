package com.eainde.workout.tool;

import com.eainde.workout.agent.ExtractionRun;
import com.eainde.workout.tool.output.ToolOutput;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.agent.tool.ToolSpecification;

/**
 * A capability the logging agent exposes to the model.
 *
 * <p>Implementations read earlier results from the run's result store instead of
 * receiving large structures back from the model. They signal failure by throwing;
 * the agent turns exceptions into tool error results.</p>
 */
public interface WorkoutTool {

    ToolId id();

    /**
     * Name, description and input schema advertised to the model.
     */
    ToolSpecification specification();

    ToolOutput execute(JsonNode input, ExtractionRun run);
}
