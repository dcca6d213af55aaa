package io.fabflow.core.flow;

import java.time.Instant;

/// Events emitted by the {@link FlowOrchestrator} while planning.
///
/// ### Event Flow
/// ```
/// StateEntered(INIT) → StateEntered(CLASSIFYING) → ... → StepEmitted | StepSkipped → ...
///                                                                  → FlowCompleted
///                                                    (on fatal error) → FlowFailed
/// ```
///
/// @see FlowObserver for event consumers
public sealed interface FlowEvent {

    /// Returns the identifier of the planning cycle.
    ///
    /// @return cycle id, never null
    String flowId();

    /// Returns when the event occurred.
    ///
    /// @return event timestamp, never null
    Instant timestamp();

    /// Emitted on every state transition.
    ///
    /// @param flowId the planning cycle
    /// @param state the state entered
    /// @param orderIndex order index of the change being planned, `-1` outside the loop
    /// @param timestamp when the state was entered
    record StateEntered(String flowId, FlowState state, int orderIndex, Instant timestamp)
            implements FlowEvent {

        public static StateEntered now(String flowId, FlowState state, int orderIndex) {
            return new StateEntered(flowId, state, orderIndex, Instant.now());
        }
    }

    /// Emitted when a step is appended to the flow.
    ///
    /// @param flowId the planning cycle
    /// @param step the step, carrying its provisional number
    /// @param timestamp when the step was emitted
    record StepEmitted(String flowId, ProcessStep step, Instant timestamp) implements FlowEvent {

        public static StepEmitted now(String flowId, ProcessStep step) {
            return new StepEmitted(flowId, step, Instant.now());
        }
    }

    /// Emitted when a change is skipped.
    ///
    /// @param flowId the planning cycle
    /// @param diagnostic why the change was skipped
    /// @param timestamp when the change was skipped
    record StepSkipped(String flowId, Diagnostic diagnostic, Instant timestamp)
            implements FlowEvent {

        public static StepSkipped now(String flowId, Diagnostic diagnostic) {
            return new StepSkipped(flowId, diagnostic, Instant.now());
        }
    }

    /// Emitted once the flow is renumbered and complete.
    ///
    /// @param flowId the planning cycle
    /// @param result the final flow and diagnostics
    /// @param timestamp when planning finished
    record FlowCompleted(String flowId, FlowResult result, Instant timestamp)
            implements FlowEvent {

        public static FlowCompleted now(String flowId, FlowResult result) {
            return new FlowCompleted(flowId, result, Instant.now());
        }
    }

    /// Emitted when planning aborts; no flow is produced.
    ///
    /// @param flowId the planning cycle
    /// @param orderIndex order index of the change that failed
    /// @param error the fatal error
    /// @param timestamp when planning aborted
    record FlowFailed(String flowId, int orderIndex, Exception error, Instant timestamp)
            implements FlowEvent {

        public static FlowFailed now(String flowId, int orderIndex, Exception error) {
            return new FlowFailed(flowId, orderIndex, error, Instant.now());
        }
    }
}
