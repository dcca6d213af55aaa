package io.fabflow.core.flow;

import java.util.Objects;

/// Non-fatal planning finding attached to a {@link FlowResult}.
///
/// @param orderIndex order index of the skipped change
/// @param kind why the change was skipped, not null
/// @param message human-readable detail, not null
public record Diagnostic(int orderIndex, DiagnosticKind kind, String message) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return "[" + kind + " @" + orderIndex + "] " + message;
    }
}
