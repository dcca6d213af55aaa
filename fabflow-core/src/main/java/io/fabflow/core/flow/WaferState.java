package io.fabflow.core.flow;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/// Materials present on the wafer at the current point of the flow.
///
/// Starts with the substrate. Every emitted deposition adds its primary material, so later
/// steps are checked against everything the wafer already carries.
///
/// @implNote Not thread-safe. Owned by a single {@link PlanningContext}.
public final class WaferState {

    private final Set<String> materials = new LinkedHashSet<>();

    /// Creates the state of a bare wafer.
    ///
    /// @param substrate substrate material, not null
    public WaferState(String substrate) {
        Objects.requireNonNull(substrate, "substrate must not be null");
        materials.add(substrate);
    }

    void deposit(String material) {
        Objects.requireNonNull(material, "material must not be null");
        materials.add(material);
    }

    /// Returns the materials present, in order of first appearance.
    ///
    /// @return unmodifiable view, never null
    public Set<String> materials() {
        return Collections.unmodifiableSet(materials);
    }
}
