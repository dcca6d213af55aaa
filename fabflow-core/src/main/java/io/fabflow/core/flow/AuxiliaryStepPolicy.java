package io.fabflow.core.flow;

import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.classify.Classification;
import io.fabflow.core.classify.ProcessCategory;
import io.fabflow.core.classify.ProcessSubtype;
import java.util.Optional;

/// Decides whether an extra step must be planned before a classified change.
///
/// The returned descriptor goes through tool selection and recipe planning like any explicit
/// change, but its step is marked {@link ProcessStep#INJECTED}.
///
/// @see #none()
/// @see #patterningBeforeAnisotropicEtch()
@FunctionalInterface
public interface AuxiliaryStepPolicy {

    /// Returns the change to plan before `descriptor`, if any.
    ///
    /// @param descriptor the change about to be planned, not null
    /// @param classification its classification, never unknown, not null
    /// @param context state of the current cycle, not null
    /// @return a patterning descriptor to plan first, or empty
    Optional<ChangeDescriptor> stepBefore(
            ChangeDescriptor descriptor, Classification classification, PlanningContext context);

    /// Policy that never injects anything.
    static AuxiliaryStepPolicy none() {
        return (descriptor, classification, context) -> Optional.empty();
    }

    /// Policy injecting a lithography step before an anisotropic etch.
    ///
    /// Applies only if the previous emitted step is not already lithography and a layout is
    /// mapped under `LITHO_STEP_<orderIndex + 1>`.
    static AuxiliaryStepPolicy patterningBeforeAnisotropicEtch() {
        return (descriptor, classification, context) -> {
            if (classification.category() != ProcessCategory.ETCH
                    || classification.subtype() != ProcessSubtype.ANISOTROPIC) {
                return Optional.empty();
            }
            if (context.lastEmittedCategory().orElse(null) == ProcessCategory.LITHOGRAPHY) {
                return Optional.empty();
            }
            String stepId = "LITHO_STEP_" + (descriptor.orderIndex() + 1);
            if (context.layoutReference(stepId).isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(
                    ChangeDescriptor.builder()
                            .primaryMaterial(descriptor.primaryMaterial())
                            .waferSize(descriptor.waferSize())
                            .orderIndex(descriptor.orderIndex())
                            .patterning(stepId)
                            .build());
        };
    }
}
