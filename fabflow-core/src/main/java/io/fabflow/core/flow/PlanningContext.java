package io.fabflow.core.flow;

import io.fabflow.core.classify.ProcessCategory;
import io.fabflow.core.tool.ToolLoad;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Mutable state of exactly one planning cycle.
///
/// Created per {@link FlowOrchestrator#plan(FlowRequest)} call and discarded afterwards, so
/// nothing leaks between cycles and the orchestrator itself stays reentrant.
///
/// @implNote Not thread-safe. Confined to the planning thread.
public final class PlanningContext {

    private final String flowId;
    private final Map<String, String> layoutReferences;
    private final ToolAssignmentCounter assignments = new ToolAssignmentCounter();
    private final WaferState wafer;
    private final List<ProcessStep> steps = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    PlanningContext(String flowId, Map<String, String> layoutReferences, String substrate) {
        this.flowId = Objects.requireNonNull(flowId, "flowId must not be null");
        this.layoutReferences =
                Objects.requireNonNull(layoutReferences, "layoutReferences must not be null");
        this.wafer = new WaferState(substrate);
    }

    public String getFlowId() {
        return flowId;
    }

    /// Returns the layout reference mapped to a lithography step.
    ///
    /// @param stepIdentifier lithography step identifier, not null
    /// @return the layout reference, or empty if none was supplied
    public Optional<String> layoutReference(String stepIdentifier) {
        String reference = layoutReferences.get(stepIdentifier);
        return reference == null || reference.isBlank() ? Optional.empty() : Optional.of(reference);
    }

    public ToolLoad toolLoad() {
        return assignments;
    }

    public WaferState wafer() {
        return wafer;
    }

    /// Returns the category of the most recently emitted step.
    ///
    /// @return the category, or empty before the first step
    public Optional<ProcessCategory> lastEmittedCategory() {
        return steps.isEmpty()
                ? Optional.empty()
                : Optional.of(steps.get(steps.size() - 1).category());
    }

    public List<ProcessStep> steps() {
        return Collections.unmodifiableList(steps);
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    void recordStep(ProcessStep step) {
        steps.add(step);
        assignments.recordAssignment(step.toolId());
    }

    void recordDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /// Renumbers emitted steps densely from 1 in emission order.
    ///
    /// @return the final flow, never null
    ProcessFlow toFlow() {
        List<ProcessStep> numbered = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            numbered.add(steps.get(i).withStepNumber(i + 1));
        }
        return new ProcessFlow(numbered);
    }
}
