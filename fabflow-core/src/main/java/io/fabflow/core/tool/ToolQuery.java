package io.fabflow.core.tool;

import io.fabflow.core.change.WaferSize;
import io.fabflow.core.classify.ProcessCategory;
import java.util.Objects;
import java.util.Set;

/// Constraint bundle sent to the {@link KnowledgeStore}.
///
/// @param category process category the tool must support, not null
/// @param waferSize wafer size the tool must accept, not null
/// @param materials materials the step touches, never null after construction
public record ToolQuery(ProcessCategory category, WaferSize waferSize, Set<String> materials) {

    public ToolQuery {
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(waferSize, "waferSize must not be null");
        materials = materials != null ? Set.copyOf(materials) : Set.of();
    }
}
