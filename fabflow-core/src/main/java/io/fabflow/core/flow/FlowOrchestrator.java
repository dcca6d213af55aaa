package io.fabflow.core.flow;

import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.change.ChangeDescriptorValidator;
import io.fabflow.core.change.Polarity;
import io.fabflow.core.classify.Classification;
import io.fabflow.core.classify.ProcessClassifier;
import io.fabflow.core.flow.CollaboratorUnavailableException.Collaborator;
import io.fabflow.core.flow.FlowPlanningException.FailureReason;
import io.fabflow.core.litho.LithographyPlanner;
import io.fabflow.core.litho.MaskServiceUnavailableException;
import io.fabflow.core.optimize.ParameterOptimizer;
import io.fabflow.core.recipe.RecipeParameters;
import io.fabflow.core.tool.KnowledgeStoreUnavailableException;
import io.fabflow.core.tool.NoCompatibleToolException;
import io.fabflow.core.tool.ToolRecord;
import io.fabflow.core.tool.ToolSelector;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Drives change descriptors through classification, tool selection and recipe planning.
///
/// ### Planning Loop
/// 1. Validate every descriptor; any violation or duplicate order index fails the cycle
/// 2. Sort descriptors by order index
/// 3. For each change: classify, ask the {@link AuxiliaryStepPolicy} for an extra step,
///    select a tool, plan the recipe and append the step
/// 4. Renumber the emitted steps densely from 1
///
/// ### Outcomes
/// | Situation | Result |
/// |---|---|
/// | UNKNOWN classification | step skipped, {@link DiagnosticKind#UNKNOWN_CLASSIFICATION} |
/// | no eligible tool | step skipped, {@link DiagnosticKind#NO_COMPATIBLE_TOOL} |
/// | malformed descriptor, missing layout, tool without surrogate | {@link FlowPlanningException} |
/// | knowledge store or mask service down | {@link CollaboratorUnavailableException} |
///
/// A failed cycle never yields a partial flow.
///
/// @implNote Per-cycle state lives in a fresh {@link PlanningContext}, so one orchestrator can
/// plan several requests, even concurrently, provided its collaborators allow it. Observer
/// registration is thread-safe ({@link CopyOnWriteArrayList}).
///
/// @see FlowObserver for progress events
public final class FlowOrchestrator {

    private static final Logger logger = Logger.getLogger(FlowOrchestrator.class.getName());

    private static final int OUTSIDE_LOOP = -1;

    private final ChangeDescriptorValidator validator;
    private final ProcessClassifier classifier;
    private final ToolSelector toolSelector;
    private final ParameterOptimizer optimizer;
    private final LithographyPlanner lithographyPlanner;
    private final AuxiliaryStepPolicy auxiliaryStepPolicy;
    private final String substrate;
    private final List<FlowObserver> observers = new CopyOnWriteArrayList<>();

    /// Creates an orchestrator.
    ///
    /// @param validator descriptor contract checks, not null
    /// @param classifier rule-table classifier, not null
    /// @param toolSelector tool resolution, not null
    /// @param optimizer deposition and etch recipe optimizer, not null
    /// @param lithographyPlanner lithography recipe planner, not null
    /// @param auxiliaryStepPolicy extra-step policy, not null
    /// @param substrate material of the bare wafer, not null
    public FlowOrchestrator(
            ChangeDescriptorValidator validator,
            ProcessClassifier classifier,
            ToolSelector toolSelector,
            ParameterOptimizer optimizer,
            LithographyPlanner lithographyPlanner,
            AuxiliaryStepPolicy auxiliaryStepPolicy,
            String substrate) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.toolSelector = Objects.requireNonNull(toolSelector, "toolSelector must not be null");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
        this.lithographyPlanner =
                Objects.requireNonNull(lithographyPlanner, "lithographyPlanner must not be null");
        this.auxiliaryStepPolicy =
                Objects.requireNonNull(auxiliaryStepPolicy, "auxiliaryStepPolicy must not be null");
        this.substrate = Objects.requireNonNull(substrate, "substrate must not be null");
    }

    /// Registers an observer to receive planning events.
    ///
    /// @param observer the observer to add, not null
    public void addObserver(FlowObserver observer) {
        Objects.requireNonNull(observer, "observer must not be null");
        observers.add(observer);
    }

    /// Removes a previously registered observer.
    ///
    /// @param observer the observer to remove
    /// @return `true` if the observer was present and removed
    public boolean removeObserver(FlowObserver observer) {
        return observers.remove(observer);
    }

    /// Plans a process flow.
    ///
    /// @param request change descriptors and layout references, not null
    /// @return the renumbered flow and its diagnostics, never null
    /// @throws FlowPlanningException if the input violates a planning contract
    /// @throws CollaboratorUnavailableException if the knowledge store or mask service is
    ///     unreachable
    public FlowResult plan(FlowRequest request)
            throws FlowPlanningException, CollaboratorUnavailableException {
        Objects.requireNonNull(request, "request must not be null");

        PlanningContext context =
                new PlanningContext(
                        UUID.randomUUID().toString(), request.layoutReferences(), substrate);
        enter(context, FlowState.INIT, OUTSIDE_LOOP);
        logger.info(
                "Planning flow " + context.getFlowId() + " for " + request.changes().size()
                        + " changes");

        validate(context, request.changes());

        List<ChangeDescriptor> ordered =
                request.changes().stream()
                        .sorted(Comparator.comparingInt(ChangeDescriptor::orderIndex))
                        .toList();

        for (ChangeDescriptor descriptor : ordered) {
            enter(context, FlowState.CLASSIFYING, descriptor.orderIndex());
            Classification classification = classifier.classify(descriptor);

            if (classification.isUnknown()) {
                skip(
                        context,
                        new Diagnostic(
                                descriptor.orderIndex(),
                                DiagnosticKind.UNKNOWN_CLASSIFICATION,
                                "No process matches change of " + descriptor.primaryMaterial()
                                        + " (polarity " + descriptor.polarity() + ")"));
                continue;
            }

            Optional<ChangeDescriptor> auxiliary =
                    auxiliaryStepPolicy.stepBefore(descriptor, classification, context);
            if (auxiliary.isPresent()) {
                logger.info(
                        "Injecting " + auxiliary.get().stepIdentifier() + " before change "
                                + descriptor.orderIndex());
                planStep(context, auxiliary.get(), Classification.lithography(), true);
            }

            planStep(context, descriptor, classification, false);
        }

        FlowResult result = new FlowResult(context.toFlow(), context.diagnostics());
        enter(context, FlowState.DONE, OUTSIDE_LOOP);
        notifyObservers(FlowEvent.FlowCompleted.now(context.getFlowId(), result));
        return result;
    }

    public List<FlowObserver> getObservers() {
        return List.copyOf(observers);
    }

    private void validate(PlanningContext context, List<ChangeDescriptor> changes)
            throws FlowPlanningException {
        for (ChangeDescriptor descriptor : changes) {
            List<String> violations = validator.violations(descriptor);
            if (!violations.isEmpty()) {
                throw fail(
                        context,
                        new FlowPlanningException(
                                FailureReason.MALFORMED_DESCRIPTOR,
                                descriptor.orderIndex(),
                                "Malformed change " + descriptor.orderIndex() + ": "
                                        + String.join("; ", violations)));
            }
        }
        List<Integer> duplicates = validator.duplicateOrderIndices(changes);
        if (!duplicates.isEmpty()) {
            throw fail(
                    context,
                    new FlowPlanningException(
                            FailureReason.MALFORMED_DESCRIPTOR,
                            duplicates.get(0),
                            "Duplicate order indices " + duplicates));
        }
    }

    private void planStep(
            PlanningContext context,
            ChangeDescriptor descriptor,
            Classification classification,
            boolean injected)
            throws FlowPlanningException, CollaboratorUnavailableException {
        int orderIndex = descriptor.orderIndex();

        String layoutReference = null;
        if (classification.isLithography()) {
            layoutReference = context.layoutReference(descriptor.stepIdentifier()).orElse(null);
            if (layoutReference == null) {
                throw fail(
                        context,
                        new FlowPlanningException(
                                FailureReason.MISSING_LAYOUT_REFERENCE,
                                orderIndex,
                                "No layout reference for " + descriptor.stepIdentifier()));
            }
        }

        enter(context, FlowState.SELECTING_TOOL, orderIndex);
        ToolRecord tool;
        try {
            tool =
                    toolSelector.select(
                            classification,
                            descriptor,
                            context.toolLoad(),
                            context.wafer().materials());
        } catch (NoCompatibleToolException e) {
            skip(
                    context,
                    new Diagnostic(orderIndex, DiagnosticKind.NO_COMPATIBLE_TOOL, e.getMessage()));
            return;
        } catch (KnowledgeStoreUnavailableException e) {
            throw fail(
                    context,
                    new CollaboratorUnavailableException(
                            Collaborator.KNOWLEDGE_STORE,
                            orderIndex,
                            "Knowledge store unavailable at change " + orderIndex + ": "
                                    + e.getMessage(),
                            e));
        }

        enter(context, FlowState.OPTIMIZING, orderIndex);
        RecipeParameters recipe;
        if (classification.isLithography()) {
            try {
                recipe = lithographyPlanner.plan(descriptor.stepIdentifier(), layoutReference);
            } catch (MaskServiceUnavailableException e) {
                throw fail(
                        context,
                        new CollaboratorUnavailableException(
                                Collaborator.MASK_SERVICE,
                                orderIndex,
                                "Mask service unavailable for " + descriptor.stepIdentifier()
                                        + ": " + e.getMessage(),
                                e));
            }
        } else {
            if (tool.surrogateModel() == null) {
                throw fail(
                        context,
                        new FlowPlanningException(
                                FailureReason.INCOMPLETE_TOOL_RECORD,
                                orderIndex,
                                "Tool " + tool.toolId() + " has no surrogate model"));
            }
            recipe = optimizer.optimize(tool, classification, descriptor);
        }

        ProcessStep step =
                new ProcessStep(
                        orderIndex + 1,
                        classification.category(),
                        tool.toolId(),
                        recipe,
                        injected ? ProcessStep.INJECTED : orderIndex);
        context.recordStep(step);
        if (descriptor.polarity() == Polarity.ADDITION) {
            context.wafer().deposit(descriptor.primaryMaterial());
        }
        enter(context, FlowState.STEP_EMITTED, orderIndex);
        notifyObservers(FlowEvent.StepEmitted.now(context.getFlowId(), step));
    }

    private void skip(PlanningContext context, Diagnostic diagnostic) {
        logger.warning("Skipping change " + diagnostic.orderIndex() + ": " + diagnostic.message());
        context.recordDiagnostic(diagnostic);
        enter(context, FlowState.STEP_SKIPPED, diagnostic.orderIndex());
        notifyObservers(FlowEvent.StepSkipped.now(context.getFlowId(), diagnostic));
    }

    private FlowPlanningException fail(PlanningContext context, FlowPlanningException error) {
        publishFailure(context, error.getOrderIndex(), error);
        return error;
    }

    private CollaboratorUnavailableException fail(
            PlanningContext context, CollaboratorUnavailableException error) {
        publishFailure(context, error.getOrderIndex(), error);
        return error;
    }

    private void publishFailure(PlanningContext context, int orderIndex, Exception error) {
        logger.severe("Flow " + context.getFlowId() + " failed: " + error.getMessage());
        enter(context, FlowState.FLOW_FAILED, orderIndex);
        notifyObservers(FlowEvent.FlowFailed.now(context.getFlowId(), orderIndex, error));
    }

    private void enter(PlanningContext context, FlowState state, int orderIndex) {
        notifyObservers(FlowEvent.StateEntered.now(context.getFlowId(), state, orderIndex));
    }

    private void notifyObservers(FlowEvent event) {
        for (FlowObserver observer : observers) {
            try {
                observer.onEvent(event);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Flow observer failed on " + event.getClass().getSimpleName(),
                        e);
            }
        }
    }
}
