package io.fabflow.core.optimize;

/// Outcome of a bounded minimization run.
///
/// @param point best point found, in parameter units, within bounds
/// @param value objective value at `point`
/// @param iterations iterations (or grid evaluations) spent
/// @param converged whether the stopping criterion was met within the budget
public record MinimizationResult(double[] point, double value, int iterations, boolean converged) {

    public MinimizationResult {
        point = point.clone();
    }

    @Override
    public double[] point() {
        return point.clone();
    }
}
