package io.fabflow.core.tool;

import io.fabflow.core.classify.ProcessCategory;
import java.io.Serial;

/// Thrown when no tool satisfies the hard constraints of a step.
///
/// A planning-level negative: the step cannot be run with the current tool set, and the
/// orchestrator skips it ("replan") rather than aborting the flow.
public class NoCompatibleToolException extends Exception {

    @Serial private static final long serialVersionUID = -2405361196154727790L;

    private final ProcessCategory category;
    private final int orderIndex;

    /// Creates the exception.
    ///
    /// @param category category of the unplannable step, not null
    /// @param orderIndex order index of the change
    /// @param message description of the rejected constraints
    public NoCompatibleToolException(ProcessCategory category, int orderIndex, String message) {
        super(message);
        this.category = category;
        this.orderIndex = orderIndex;
    }

    public ProcessCategory getCategory() {
        return category;
    }

    public int getOrderIndex() {
        return orderIndex;
    }
}
