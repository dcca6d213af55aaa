package io.fabflow.core.change;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Checks the required-attribute contract of {@link ChangeDescriptor}s before planning.
///
/// Patterning transitions need identity attributes and a step identifier. Geometric attributes
/// are required for every other transition, and also for a patterning transition that carries
/// a polarity, since the classifier ranks polarity above the patterning flag and plans such a
/// transition as a deposition or etch. A missing `polarity` is **not** a
/// violation: it denotes a change whose direction upstream could not determine, which the
/// classifier maps to an unknown process.
///
/// @implNote Stateless and thread-safe.
public final class ChangeDescriptorValidator {

    /// Returns the contract violations of a single descriptor.
    ///
    /// @param descriptor the descriptor to check, not null
    /// @return human-readable violations, empty if the descriptor is well-formed, never null
    public List<String> violations(ChangeDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        List<String> violations = new ArrayList<>();

        if (descriptor.primaryMaterial() == null || descriptor.primaryMaterial().isBlank()) {
            violations.add("primary_material is required");
        }
        if (descriptor.waferSize() == null) {
            violations.add("wafer_size is required");
        }
        if (descriptor.orderIndex() < 0) {
            violations.add("order_index must be >= 0");
        }

        if (descriptor.isPatterning()) {
            if (descriptor.stepIdentifier() == null || descriptor.stepIdentifier().isBlank()) {
                violations.add("step_id is required for a patterning transition");
            }
            if (descriptor.polarity() == null) {
                return violations;
            }
        }

        if (!Double.isFinite(descriptor.aspectRatio()) || descriptor.aspectRatio() <= 0) {
            violations.add("aspect_ratio must be a positive number");
        }
        double conformality = descriptor.conformalityScore();
        if (!Double.isFinite(conformality) || conformality < 0 || conformality > 1) {
            violations.add("conformality_score must lie in [0, 1]");
        }
        if (!Double.isFinite(descriptor.targetMetric()) || descriptor.targetMetric() < 0) {
            violations.add("target_metric must be a non-negative number");
        }
        return violations;
    }

    /// Returns the order indices that occur more than once in a sequence.
    ///
    /// @param descriptors the full input sequence, not null
    /// @return duplicated order indices in encounter order, never null
    public List<Integer> duplicateOrderIndices(List<ChangeDescriptor> descriptors) {
        Set<Integer> seen = new HashSet<>();
        List<Integer> duplicates = new ArrayList<>();
        for (ChangeDescriptor descriptor : descriptors) {
            if (!seen.add(descriptor.orderIndex()) && !duplicates.contains(descriptor.orderIndex())) {
                duplicates.add(descriptor.orderIndex());
            }
        }
        return duplicates;
    }
}
