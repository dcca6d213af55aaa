package io.fabflow.serialization;

import io.fabflow.core.optimize.surrogate.SurrogateModelRegistry;
import io.fabflow.core.tool.InMemoryKnowledgeStore;
import io.fabflow.core.tool.ToolRecord;
import java.util.List;
import java.util.Objects;

/// Tool catalog read from JSON: the tools of a fab and the surrogate models they reference.
///
/// Surrogate models are fitted while reading, so every {@link ToolRecord} that named a model
/// already carries it.
///
/// @param tools catalog tools in file order, never null after construction
/// @param surrogateModels every model declared by the catalog, keyed by reference, not null
/// @see FlowSerializer#readToolCatalog(String)
public record ToolCatalog(List<ToolRecord> tools, SurrogateModelRegistry surrogateModels) {

    public ToolCatalog {
        tools = tools != null ? List.copyOf(tools) : List.of();
        Objects.requireNonNull(surrogateModels, "surrogateModels must not be null");
    }

    /// Loads the catalog tools into a fresh in-memory knowledge store.
    ///
    /// @return new store holding every catalog tool, never null
    public InMemoryKnowledgeStore toKnowledgeStore() {
        return new InMemoryKnowledgeStore(tools);
    }
}
