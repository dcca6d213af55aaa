package io.fabflow.core.classify;

import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.change.Polarity;

/// Classifies a removal with an aspect ratio below `maxAspectRatio` as an anisotropic etch.
///
/// @param maxAspectRatio exclusive upper aspect-ratio bound
public record AnisotropicEtchRule(double maxAspectRatio) implements ClassificationRule {

    @Override
    public Classification evaluate(ChangeDescriptor descriptor) {
        if (descriptor.polarity() == Polarity.REMOVAL
                && descriptor.aspectRatio() < maxAspectRatio) {
            return Classification.of(ProcessCategory.ETCH, ProcessSubtype.ANISOTROPIC);
        }
        return null;
    }
}
