package io.fabflow.core.classify;

import io.fabflow.core.change.ChangeDescriptor;

/// Sealed interface for process classification rules.
///
/// Rules are evaluated in table order by {@link ProcessClassifier}; the first rule
/// returning a non-null classification wins.
///
/// ### Permitted Implementations
/// - {@link ConformalDepositionRule} - addition with a high aspect ratio
/// - {@link PlanarDepositionRule} - any other addition
/// - {@link AnisotropicEtchRule} - removal with a low aspect ratio
/// - {@link IsotropicEtchRule} - any other removal
/// - {@link PatterningRule} - transition flagged as lithography upstream
///
/// @implNote Implementations must be immutable, stateless and must never throw.
///
/// @see ProcessClassifier for rule evaluation
public sealed interface ClassificationRule
        permits AnisotropicEtchRule,
                ConformalDepositionRule,
                IsotropicEtchRule,
                PatterningRule,
                PlanarDepositionRule {

    /// Evaluates whether this rule applies and returns its classification.
    ///
    /// @param descriptor the change to classify, not null
    /// @return the classification if the rule applies, null otherwise
    Classification evaluate(ChangeDescriptor descriptor);
}
