package io.fabflow.core.flow;

import java.util.List;
import java.util.Objects;

/// Ordered manufacturing sequence produced by a planning cycle.
///
/// List order is manufacturing order and step numbers are `1..n` without gaps.
///
/// @param steps the steps, never null after construction
public record ProcessFlow(List<ProcessStep> steps) {

    public ProcessFlow {
        Objects.requireNonNull(steps, "steps must not be null");
        steps = List.copyOf(steps);
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i).stepNumber() != i + 1) {
                throw new IllegalArgumentException(
                        "Step at position " + i + " is numbered " + steps.get(i).stepNumber());
            }
        }
    }

    public static ProcessFlow empty() {
        return new ProcessFlow(List.of());
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /// Returns a step by its 1-based number.
    ///
    /// @param stepNumber step number between 1 and {@link #size()}
    /// @return the step, never null
    /// @throws IndexOutOfBoundsException if no such step exists
    public ProcessStep step(int stepNumber) {
        return steps.get(stepNumber - 1);
    }
}
