package io.fabflow.core.flow;

/// Reasons a change was skipped without failing the flow.
public enum DiagnosticKind {
    /// No classification rule matched the change.
    UNKNOWN_CLASSIFICATION,
    /// No available tool satisfied the step's hard constraints.
    NO_COMPATIBLE_TOOL
}
