package io.fabflow.core.classify;

import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.change.Polarity;

/// Classifies an addition with an aspect ratio above `minAspectRatio` as a conformal deposition.
///
/// @param minAspectRatio exclusive lower aspect-ratio bound
public record ConformalDepositionRule(double minAspectRatio) implements ClassificationRule {

    @Override
    public Classification evaluate(ChangeDescriptor descriptor) {
        if (descriptor.polarity() == Polarity.ADDITION
                && descriptor.aspectRatio() > minAspectRatio) {
            return Classification.of(ProcessCategory.DEPOSITION, ProcessSubtype.CONFORMAL);
        }
        return null;
    }
}
