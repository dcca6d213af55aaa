package io.fabflow.core.classify;

/// Refinement of a {@link ProcessCategory} describing the geometric behavior of the process.
public enum ProcessSubtype {
    /// Deposition following the underlying topography uniformly.
    CONFORMAL,
    /// Deposition forming a flat-top fill.
    PLANAR,
    /// Directional removal.
    ANISOTROPIC,
    /// Removal proceeding equally in all directions.
    ISOTROPIC
}
