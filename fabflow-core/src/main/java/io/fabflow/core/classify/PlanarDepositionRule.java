package io.fabflow.core.classify;

import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.change.Polarity;

/// Classifies any addition as a planar deposition.
public record PlanarDepositionRule() implements ClassificationRule {

    @Override
    public Classification evaluate(ChangeDescriptor descriptor) {
        if (descriptor.polarity() == Polarity.ADDITION) {
            return Classification.of(ProcessCategory.DEPOSITION, ProcessSubtype.PLANAR);
        }
        return null;
    }
}
