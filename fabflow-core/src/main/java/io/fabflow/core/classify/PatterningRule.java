package io.fabflow.core.classify;

import io.fabflow.core.change.ChangeDescriptor;

/// Classifies a transition flagged as patterning upstream as lithography.
///
/// Patterning cannot be inferred from material polarity, so this rule only honors the flag.
public record PatterningRule() implements ClassificationRule {

    @Override
    public Classification evaluate(ChangeDescriptor descriptor) {
        return descriptor.isPatterning() ? Classification.lithography() : null;
    }
}
