package io.fabflow.core.classify;

/// Tunable aspect-ratio thresholds used by the classification rules.
///
/// @param conformalAspectRatio additions above this aspect ratio are conformal depositions
/// @param anisotropicAspectRatio removals below this aspect ratio are anisotropic etches
public record ClassificationThresholds(double conformalAspectRatio, double anisotropicAspectRatio) {

    public ClassificationThresholds {
        if (!(conformalAspectRatio > 0) || !(anisotropicAspectRatio > 0)) {
            throw new IllegalArgumentException("aspect ratio thresholds must be positive");
        }
    }

    /// Returns the documented defaults: conformal above 5, anisotropic below 0.5.
    ///
    /// @return default thresholds, never null
    public static ClassificationThresholds defaults() {
        return new ClassificationThresholds(5.0, 0.5);
    }
}
