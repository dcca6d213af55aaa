package io.fabflow.core.change;

import java.util.LinkedHashSet;
import java.util.Set;

/// Structured description of one material change detected between two consecutive
/// manufacturing stages.
///
/// Descriptors are produced by the upstream perception collaborators (registration,
/// segmentation and differencing) and consumed by the planning engine. The record does
/// **not** reject missing attributes: a malformed descriptor must be able to reach the
/// orchestrator so it can be reported as an input contract violation. Use
/// {@link ChangeDescriptorValidator} to check the required-attribute contract.
///
/// ### Contracts
/// - **Postcondition**: `affectedMaterials` is immutable and contains `primaryMaterial`
///   whenever the latter is non-null
/// - **Invariant**: all fields immutable after construction
///
/// ### Usage
/// {@snippet :
/// ChangeDescriptor oxide = ChangeDescriptor.builder()
///     .polarity(Polarity.ADDITION)
///     .primaryMaterial("oxide")
///     .aspectRatio(8.0)
///     .conformalityScore(0.9)
///     .targetMetric(200.0)
///     .waferSize(WaferSize.MM_300)
///     .orderIndex(0)
///     .build();
/// }
///
/// @param polarity direction of the change, may be null when upstream could not determine it
/// @param primaryMaterial material added or removed, required
/// @param affectedMaterials every material touched by the change, never null after construction
/// @param aspectRatio height-to-width proxy of the changed region, must be positive
/// @param conformalityScore how uniformly an added layer follows topography, in `[0, 1]`
/// @param targetMetric target thickness (addition) or depth (removal) in nanometers
/// @param waferSize wafer diameter, required
/// @param orderIndex zero-based position of the transition in the input sequence
/// @param patterning whether upstream flagged this transition as a lithography step
/// @param stepIdentifier lithography step identifier used to look up the layout, required when
///     `patterning`
/// @see ChangeDescriptorValidator
public record ChangeDescriptor(
        Polarity polarity,
        String primaryMaterial,
        Set<String> affectedMaterials,
        double aspectRatio,
        double conformalityScore,
        double targetMetric,
        WaferSize waferSize,
        int orderIndex,
        boolean patterning,
        String stepIdentifier) {

    /// Compact constructor normalizing the material set.
    public ChangeDescriptor {
        Set<String> materials = new LinkedHashSet<>();
        if (primaryMaterial != null) {
            materials.add(primaryMaterial);
        }
        if (affectedMaterials != null) {
            affectedMaterials.stream().filter(m -> m != null).forEach(materials::add);
        }
        affectedMaterials = Set.copyOf(materials);
    }

    /// Returns whether the transition carries an upstream lithography flag.
    ///
    /// @return `true` for patterning transitions
    public boolean isPatterning() {
        return patterning;
    }

    /// Creates a new builder.
    ///
    /// @return empty builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-populated with this descriptor's values.
    ///
    /// @return builder copy, never null
    public Builder toBuilder() {
        return new Builder()
                .polarity(polarity)
                .primaryMaterial(primaryMaterial)
                .affectedMaterials(affectedMaterials)
                .aspectRatio(aspectRatio)
                .conformalityScore(conformalityScore)
                .targetMetric(targetMetric)
                .waferSize(waferSize)
                .orderIndex(orderIndex)
                .patterning(patterning)
                .stepIdentifier(stepIdentifier);
    }

    /// Fluent builder for {@link ChangeDescriptor}.
    ///
    /// Numeric attributes default to `NaN` so that an omitted value is caught by
    /// {@link ChangeDescriptorValidator} instead of silently reading as zero.
    public static final class Builder {
        private Polarity polarity;
        private String primaryMaterial;
        private Set<String> affectedMaterials = Set.of();
        private double aspectRatio = Double.NaN;
        private double conformalityScore = Double.NaN;
        private double targetMetric = Double.NaN;
        private WaferSize waferSize;
        private int orderIndex = -1;
        private boolean patterning;
        private String stepIdentifier;

        private Builder() {}

        public Builder polarity(Polarity polarity) {
            this.polarity = polarity;
            return this;
        }

        public Builder primaryMaterial(String primaryMaterial) {
            this.primaryMaterial = primaryMaterial;
            return this;
        }

        public Builder affectedMaterials(Set<String> affectedMaterials) {
            this.affectedMaterials = affectedMaterials;
            return this;
        }

        public Builder aspectRatio(double aspectRatio) {
            this.aspectRatio = aspectRatio;
            return this;
        }

        public Builder conformalityScore(double conformalityScore) {
            this.conformalityScore = conformalityScore;
            return this;
        }

        public Builder targetMetric(double targetMetric) {
            this.targetMetric = targetMetric;
            return this;
        }

        public Builder waferSize(WaferSize waferSize) {
            this.waferSize = waferSize;
            return this;
        }

        public Builder orderIndex(int orderIndex) {
            this.orderIndex = orderIndex;
            return this;
        }

        /// Marks the transition as a lithography step identified by `stepIdentifier`.
        ///
        /// @param stepIdentifier layout lookup key, not null
        /// @return this builder for chaining, never null
        public Builder patterning(String stepIdentifier) {
            this.patterning = true;
            this.stepIdentifier = stepIdentifier;
            return this;
        }

        public Builder patterning(boolean patterning) {
            this.patterning = patterning;
            return this;
        }

        public Builder stepIdentifier(String stepIdentifier) {
            this.stepIdentifier = stepIdentifier;
            return this;
        }

        /// Builds the descriptor without validating required attributes.
        ///
        /// @return the descriptor, never null
        public ChangeDescriptor build() {
            return new ChangeDescriptor(
                    polarity,
                    primaryMaterial,
                    affectedMaterials,
                    aspectRatio,
                    conformalityScore,
                    targetMetric,
                    waferSize,
                    orderIndex,
                    patterning,
                    stepIdentifier);
        }
    }
}
