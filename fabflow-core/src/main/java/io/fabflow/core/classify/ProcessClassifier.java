package io.fabflow.core.classify;

import io.fabflow.core.change.ChangeDescriptor;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Maps a {@link ChangeDescriptor} to a process {@link Classification} using an ordered
/// rule table.
///
/// ### Standard Rule Table
/// | # | Rule | Result |
/// |---|------|--------|
/// | 1 | addition, aspect ratio > conformal threshold | DEPOSITION/CONFORMAL |
/// | 2 | addition | DEPOSITION/PLANAR |
/// | 3 | removal, aspect ratio < anisotropic threshold | ETCH/ANISOTROPIC |
/// | 4 | removal | ETCH/ISOTROPIC |
/// | 5 | patterning flag | LITHOGRAPHY |
/// | - | nothing matched | UNKNOWN |
///
/// ### Contracts
/// - **Postcondition**: {@link #classify} is total and deterministic; it never throws for a
///   non-null descriptor
///
/// @implNote Immutable and thread-safe.
///
/// @see ClassificationRule
/// @see ClassificationThresholds
public final class ProcessClassifier {

    private static final Logger logger = Logger.getLogger(ProcessClassifier.class.getName());

    private final List<ClassificationRule> rules;

    /// Creates a classifier evaluating the given rules in list order.
    ///
    /// @param rules ordered rule table, not null
    public ProcessClassifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
    }

    /// Creates a classifier with the standard rule table.
    ///
    /// @param thresholds aspect ratio thresholds, not null
    /// @return new classifier, never null
    public static ProcessClassifier standard(ClassificationThresholds thresholds) {
        Objects.requireNonNull(thresholds, "thresholds must not be null");
        return new ProcessClassifier(
                List.of(
                        new ConformalDepositionRule(thresholds.conformalAspectRatio()),
                        new PlanarDepositionRule(),
                        new AnisotropicEtchRule(thresholds.anisotropicAspectRatio()),
                        new IsotropicEtchRule(),
                        new PatterningRule()));
    }

    /// Classifies a change.
    ///
    /// @param descriptor the change to classify, not null
    /// @return the first matching rule's classification, or {@link Classification#unknown()}
    public Classification classify(ChangeDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        for (ClassificationRule rule : rules) {
            Classification classification = rule.evaluate(descriptor);
            if (classification != null) {
                logger.fine(
                        "Change " + descriptor.orderIndex() + " matched "
                                + rule.getClass().getSimpleName() + " -> " + classification);
                return classification;
            }
        }
        return Classification.unknown();
    }

    /// Returns the rule table in evaluation order.
    ///
    /// @return immutable rule list, never null
    public List<ClassificationRule> getRules() {
        return rules;
    }
}
