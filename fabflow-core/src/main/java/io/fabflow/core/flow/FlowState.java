package io.fabflow.core.flow;

/// States of a planning cycle.
///
/// ```
/// INIT → CLASSIFYING → SELECTING_TOOL → OPTIMIZING → STEP_EMITTED ─┐
///             ↑              │                                     │
///             │              └──→ STEP_SKIPPED ───────────────────┤
///             └────────────────────────────────────────────────────┘
///                                                         ... → DONE
/// ```
/// Any state may move to {@link #FLOW_FAILED}. `DONE` and `FLOW_FAILED` are terminal.
public enum FlowState {
    INIT,
    CLASSIFYING,
    SELECTING_TOOL,
    OPTIMIZING,
    STEP_EMITTED,
    STEP_SKIPPED,
    DONE,
    FLOW_FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FLOW_FAILED;
    }
}
