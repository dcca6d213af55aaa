package io.fabflow.core.flow;

/// Observer for planning events.
///
/// Observers run synchronously on the planning thread. An observer that throws is logged and
/// ignored; it never changes the outcome of the cycle.
///
/// @see FlowEvent for event types
@FunctionalInterface
public interface FlowObserver {

    /// Called when a flow event occurs.
    ///
    /// @param event the event, never null
    void onEvent(FlowEvent event);
}
