package io.fabflow.core.optimize;

import java.util.Objects;
import java.util.function.ToDoubleFunction;

/// Exhaustive evaluation of an objective on a regular grid over a {@link ParameterSpace}.
///
/// Used as the guaranteed fallback when the quasi-Newton search does not converge. Every
/// grid point lies within the bounds, and ties keep the first point in row-major order, so
/// the result is deterministic.
public final class GridSearch {

    private final int pointsPerDimension;

    /// Creates a grid search.
    ///
    /// @param pointsPerDimension grid resolution per axis, at least 2 (both bounds included)
    public GridSearch(int pointsPerDimension) {
        if (pointsPerDimension < 2) {
            throw new IllegalArgumentException("pointsPerDimension must be >= 2");
        }
        this.pointsPerDimension = pointsPerDimension;
    }

    /// Evaluates the objective on every grid point and returns the best one.
    ///
    /// @param objective function of a parameter vector, not null
    /// @param space search box, not null
    /// @return best grid point, `converged` always true, never null
    public MinimizationResult search(ToDoubleFunction<double[]> objective, ParameterSpace space) {
        Objects.requireNonNull(objective, "objective must not be null");
        Objects.requireNonNull(space, "space must not be null");

        int n = space.dimension();
        int[] cursor = new int[n];
        double[] best = null;
        double bestValue = Double.POSITIVE_INFINITY;
        int evaluations = 0;

        while (true) {
            double[] unit = new double[n];
            for (int i = 0; i < n; i++) {
                unit[i] = cursor[i] / (double) (pointsPerDimension - 1);
            }
            double[] point = space.fromUnit(unit);
            double value = objective.applyAsDouble(point);
            evaluations++;
            if (best == null || value < bestValue) {
                best = point;
                bestValue = value;
            }

            int axis = n - 1;
            while (axis >= 0 && ++cursor[axis] == pointsPerDimension) {
                cursor[axis] = 0;
                axis--;
            }
            if (axis < 0) {
                break;
            }
        }

        return new MinimizationResult(best, bestValue, evaluations, true);
    }
}
