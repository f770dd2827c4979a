package com.eainde.workout.tool;

import dev.langchain4j.agent.tool.ToolSpecification;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All tools known to the agent, advertised to the model in {@link ToolId} order.
 */
@Component
public class ToolRegistry {

    private final Map<ToolId, WorkoutTool> tools;

    public ToolRegistry(List<WorkoutTool> tools) {
        Map<ToolId, WorkoutTool> byId = new EnumMap<>(ToolId.class);
        for (WorkoutTool tool : tools) {
            if (byId.put(tool.id(), tool) != null) {
                throw new IllegalStateException("Duplicate tool registered for " + tool.id());
            }
        }
        this.tools = Collections.unmodifiableMap(byId);
    }

    public Optional<WorkoutTool> find(String toolName) {
        return ToolId.fromToolName(toolName).map(tools::get);
    }

    public List<ToolSpecification> specifications() {
        return tools.values().stream()
                .map(WorkoutTool::specification)
                .toList();
    }
}
