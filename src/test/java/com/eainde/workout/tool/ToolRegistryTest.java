package com.eainde.workout.tool;

import dev.langchain4j.agent.tool.ToolSpecification;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ToolRegistryTest {

    private static WorkoutTool tool(ToolId id) {
        WorkoutTool tool = mock(WorkoutTool.class);
        when(tool.id()).thenReturn(id);
        when(tool.specification()).thenReturn(ToolSpecification.builder().name(id.toolName()).build());
        return tool;
    }

    @Test
    void find_shouldResolveByWireName() {
        // Arrange
        WorkoutTool detect = tool(ToolId.DETECT_DISCIPLINE);
        ToolRegistry registry = new ToolRegistry(List.of(detect));

        // Act & Assert
        assertThat(registry.find("detect_discipline")).containsSame(detect);
        assertThat(registry.find("extract_workout_data")).isEmpty();
        assertThat(registry.find("delete_everything")).isEmpty();
    }

    @Test
    void specifications_shouldFollowWorkflowOrder() {
        ToolRegistry registry = new ToolRegistry(List.of(
                tool(ToolId.SAVE_WORKOUT_TO_DATABASE), tool(ToolId.DETECT_DISCIPLINE), tool(ToolId.EXTRACT_WORKOUT_DATA)));

        assertThat(registry.specifications()).extracting(ToolSpecification::name)
                .containsExactly("detect_discipline", "extract_workout_data", "save_workout_to_database");
    }

    @Test
    void constructor_shouldRejectDuplicateTools() {
        List<WorkoutTool> tools = List.of(tool(ToolId.DETECT_DISCIPLINE), tool(ToolId.DETECT_DISCIPLINE));

        assertThatThrownBy(() -> new ToolRegistry(tools)).isInstanceOf(IllegalStateException.class);
    }
}
