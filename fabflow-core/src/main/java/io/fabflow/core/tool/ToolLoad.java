package io.fabflow.core.tool;

/// Read-only view of how many steps each tool already carries in the current planning cycle.
///
/// The orchestrator owns and mutates the counter behind this view; the selector only reads it.
@FunctionalInterface
public interface ToolLoad {

    /// Returns the number of steps already assigned to a tool.
    ///
    /// @param toolId tool identifier, not null
    /// @return assigned step count, `0` for unseen tools
    int assignedSteps(String toolId);

    /// View reporting no assignments.
    ToolLoad NONE = toolId -> 0;
}
