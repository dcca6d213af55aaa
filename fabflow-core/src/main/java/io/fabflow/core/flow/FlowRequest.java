package io.fabflow.core.flow;

import io.fabflow.core.change.ChangeDescriptor;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Input of one planning cycle.
///
/// @param changes change descriptors in any order; processed by order index, not null
/// @param layoutReferences lithography step identifier to layout reference, never null after
///     construction
public record FlowRequest(List<ChangeDescriptor> changes, Map<String, String> layoutReferences) {

    public FlowRequest {
        Objects.requireNonNull(changes, "changes must not be null");
        changes = List.copyOf(changes);
        layoutReferences = layoutReferences != null ? Map.copyOf(layoutReferences) : Map.of();
    }

    /// Creates a request without layout references.
    ///
    /// @param changes the change descriptors, not null
    /// @return new request, never null
    public static FlowRequest of(List<ChangeDescriptor> changes) {
        return new FlowRequest(changes, Map.of());
    }
}
