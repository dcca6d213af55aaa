package io.fabflow.core.flow;

import java.util.List;
import java.util.Objects;

/// Outcome of a successful planning cycle.
///
/// @param flow the emitted process flow, not null
/// @param diagnostics changes skipped during planning, never null after construction
public record FlowResult(ProcessFlow flow, List<Diagnostic> diagnostics) {

    public FlowResult {
        Objects.requireNonNull(flow, "flow must not be null");
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
