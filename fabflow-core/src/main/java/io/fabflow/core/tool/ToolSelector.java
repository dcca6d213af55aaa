package io.fabflow.core.tool;

import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.classify.Classification;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Resolves a concrete tool for a classified change.
///
/// ### Selection
/// 1. Query the {@link KnowledgeStore} with the step's category, wafer size and materials
/// 2. Keep only tools passing {@link ToolRecord#isEligibleFor}; the store's answer is never
///    trusted on its own
/// 3. Order the rest by the number of steps already assigned this cycle (fewest first), then
///    by tool id (lexicographically smallest first)
///
/// The materials checked against a tool's incompatibility list are the change's affected
/// materials plus every material already present on the wafer.
///
/// @implNote Stateless and thread-safe; the only side effect is the read-only store query.
///
/// @see ToolLoad for the per-cycle load view
public final class ToolSelector {

    private static final Logger logger = Logger.getLogger(ToolSelector.class.getName());

    private static final Comparator<ToolRecord> BY_ID = Comparator.comparing(ToolRecord::toolId);

    private final KnowledgeStore knowledgeStore;

    /// Creates a selector.
    ///
    /// @param knowledgeStore store answering candidate queries, not null
    public ToolSelector(KnowledgeStore knowledgeStore) {
        this.knowledgeStore =
                Objects.requireNonNull(knowledgeStore, "knowledgeStore must not be null");
    }

    /// Selects a tool considering only the change's own materials.
    ///
    /// @see #select(Classification, ChangeDescriptor, ToolLoad, Set)
    public ToolRecord select(Classification classification, ChangeDescriptor descriptor, ToolLoad load)
            throws NoCompatibleToolException, KnowledgeStoreUnavailableException {
        return select(classification, descriptor, load, Set.of());
    }

    /// Selects the tool to run a classified change.
    ///
    /// @param classification the change's classification, not unknown, not null
    /// @param descriptor the change, not null
    /// @param load steps already assigned per tool in this cycle, not null
    /// @param waferMaterials materials already present on the wafer, not null
    /// @return the selected tool, never null
    /// @throws NoCompatibleToolException if no candidate passes the hard constraints
    /// @throws KnowledgeStoreUnavailableException if the store cannot be reached
    public ToolRecord select(
            Classification classification,
            ChangeDescriptor descriptor,
            ToolLoad load,
            Set<String> waferMaterials)
            throws NoCompatibleToolException, KnowledgeStoreUnavailableException {
        Objects.requireNonNull(classification, "classification must not be null");
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(load, "load must not be null");
        Objects.requireNonNull(waferMaterials, "waferMaterials must not be null");

        Set<String> materials = new LinkedHashSet<>(descriptor.affectedMaterials());
        materials.addAll(waferMaterials);

        List<ToolRecord> candidates =
                knowledgeStore.findCandidateTools(
                        new ToolQuery(classification.category(), descriptor.waferSize(), materials));

        List<ToolRecord> eligible =
                candidates.stream()
                        .filter(
                                tool ->
                                        tool.isEligibleFor(
                                                classification.category(),
                                                descriptor.waferSize(),
                                                materials))
                        .toList();

        if (eligible.isEmpty()) {
            throw new NoCompatibleToolException(
                    classification.category(),
                    descriptor.orderIndex(),
                    "No available " + classification.category().displayName() + " tool for "
                            + descriptor.waferSize().millimeters() + " mm wafers compatible with "
                            + materials + " (" + candidates.size() + " candidates rejected)");
        }

        Comparator<ToolRecord> byLoad =
                Comparator.comparingInt(tool -> load.assignedSteps(tool.toolId()));
        ToolRecord selected = eligible.stream().min(byLoad.thenComparing(BY_ID)).orElseThrow();

        logger.info(
                "Selected tool '" + selected.toolId() + "' for " + classification + " at change "
                        + descriptor.orderIndex() + " (" + eligible.size() + " eligible)");
        return selected;
    }
}
