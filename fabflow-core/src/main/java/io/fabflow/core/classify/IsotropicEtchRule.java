package io.fabflow.core.classify;

import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.change.Polarity;

/// Classifies any removal as an isotropic etch.
public record IsotropicEtchRule() implements ClassificationRule {

    @Override
    public Classification evaluate(ChangeDescriptor descriptor) {
        if (descriptor.polarity() == Polarity.REMOVAL) {
            return Classification.of(ProcessCategory.ETCH, ProcessSubtype.ISOTROPIC);
        }
        return null;
    }
}
