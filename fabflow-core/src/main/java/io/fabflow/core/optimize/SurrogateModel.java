package io.fabflow.core.optimize;

/// Predict-only handle to a fitted process response model.
///
/// A surrogate maps process parameters to the geometric outcome a tool achieves with them
/// (deposited thickness, etched depth). How the model was fitted is not visible here; the
/// optimizer only needs repeated, side-effect free predictions.
///
/// ### Contracts
/// - **Precondition**: `parameters` holds one value per dimension of the
///   {@link ParameterSpace} the optimizer searches, in the same order
/// - **Postcondition**: returns a finite estimate for any point inside the bounds
///
/// @implNote Implementations are assumed **not** thread-safe. A model instance is used by
/// one optimization call at a time.
///
/// @see io.fabflow.core.optimize.surrogate.KrigingSurrogateModel
@FunctionalInterface
public interface SurrogateModel {

    /// Estimates the achieved metric for a parameter vector.
    ///
    /// @param parameters parameter values in parameter-space order, not null
    /// @return estimated metric in nanometers
    double predict(double[] parameters);
}
