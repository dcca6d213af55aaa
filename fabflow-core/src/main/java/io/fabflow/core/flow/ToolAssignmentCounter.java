package io.fabflow.core.flow;

import io.fabflow.core.tool.ToolLoad;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/// Per-cycle count of steps assigned to each tool.
///
/// @implNote Not thread-safe. Owned by a single {@link PlanningContext}.
final class ToolAssignmentCounter implements ToolLoad {

    private final Map<String, Integer> counts = new HashMap<>();

    @Override
    public int assignedSteps(String toolId) {
        return counts.getOrDefault(toolId, 0);
    }

    void recordAssignment(String toolId) {
        Objects.requireNonNull(toolId, "toolId must not be null");
        counts.merge(toolId, 1, Integer::sum);
    }
}
