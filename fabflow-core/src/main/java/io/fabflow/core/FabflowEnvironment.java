package io.fabflow.core;

import io.fabflow.core.classify.ProcessClassifier;
import io.fabflow.core.flow.FlowOrchestrator;
import io.fabflow.core.optimize.ParameterOptimizer;
import io.fabflow.core.tool.KnowledgeStore;
import io.fabflow.core.tool.ToolSelector;
import java.util.concurrent.ExecutorService;

/// Container holding the wired planning components.
///
/// Implements {@link AutoCloseable} to release the executor that bounds knowledge store
/// queries, when one was created.
///
/// ### Contracts
/// - **Postcondition**: all getters return the instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link FabflowFactory#createEnvironment} or
/// {@link FabflowFactory.Builder} rather than direct construction.
public final class FabflowEnvironment implements AutoCloseable {

    private final FlowOrchestrator orchestrator;
    private final ProcessClassifier classifier;
    private final ToolSelector toolSelector;
    private final ParameterOptimizer optimizer;
    private final KnowledgeStore knowledgeStore;
    private final FabflowConfig config;
    private final ExecutorService queryExecutor;

    /// Creates an environment.
    ///
    /// @param orchestrator the flow orchestrator, not null
    /// @param classifier the classifier used by the orchestrator, not null
    /// @param toolSelector the tool selector used by the orchestrator, not null
    /// @param optimizer the optimizer used by the orchestrator, not null
    /// @param knowledgeStore the store as seen by the selector, possibly deadline-bounded, not
    ///     null
    /// @param config the configuration the components were built from, not null
    /// @param queryExecutor executor owned by the environment, may be null when queries are
    ///     not deadline-bounded
    public FabflowEnvironment(
            FlowOrchestrator orchestrator,
            ProcessClassifier classifier,
            ToolSelector toolSelector,
            ParameterOptimizer optimizer,
            KnowledgeStore knowledgeStore,
            FabflowConfig config,
            ExecutorService queryExecutor) {
        this.orchestrator = orchestrator;
        this.classifier = classifier;
        this.toolSelector = toolSelector;
        this.optimizer = optimizer;
        this.knowledgeStore = knowledgeStore;
        this.config = config;
        this.queryExecutor = queryExecutor;
    }

    public FlowOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public ProcessClassifier getClassifier() {
        return classifier;
    }

    public ToolSelector getToolSelector() {
        return toolSelector;
    }

    public ParameterOptimizer getOptimizer() {
        return optimizer;
    }

    public KnowledgeStore getKnowledgeStore() {
        return knowledgeStore;
    }

    public FabflowConfig getConfig() {
        return config;
    }

    /// Shuts down the query executor, if the environment owns one.
    ///
    /// @implNote Calls `ExecutorService.shutdownNow()` so a stuck query does not keep the JVM
    /// alive.
    @Override
    public void close() {
        if (queryExecutor != null) {
            queryExecutor.shutdownNow();
        }
    }
}
