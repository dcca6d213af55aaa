package io.fabflow.core.optimize.surrogate;

import io.fabflow.core.optimize.SurrogateModel;
import java.util.List;
import java.util.Objects;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/// Ordinary kriging response surface with a Gaussian correlation kernel.
///
/// The correlation between two runs is `exp(-sum_k theta_k * (a_k - b_k)^2)`. Fitting
/// estimates the constant trend `mu` by generalized least squares and solves the correlation
/// system once with a Cholesky solver; predictions are then `mu + r(x)^T w`, which
/// interpolate the training runs and revert to `mu` far away from them.
///
/// Fitting is an offline concern; a fitted instance is immutable and its {@link #predict} is
/// side-effect free.
///
/// ### Usage
/// {@snippet :
/// SurrogateModel model = KrigingSurrogateModel.fit(
///     List.of(
///         TrainingSample.of(50.0, 10.0, 1.0),
///         TrainingSample.of(100.0, 20.0, 1.0),
///         TrainingSample.of(60.0, 10.0, 2.0),
///         TrainingSample.of(120.0, 20.0, 2.0)),
///     new double[] {1e-2, 1e-2});
/// }
///
/// @implNote Immutable and thread-safe after fitting.
public final class KrigingSurrogateModel implements SurrogateModel {

    private static final double NUGGET = 1e-10;

    private final double[][] inputs;
    private final double[] theta;
    private final double mean;
    private final double[] weights;

    private KrigingSurrogateModel(double[][] inputs, double[] theta, double mean, double[] weights) {
        this.inputs = inputs;
        this.theta = theta;
        this.mean = mean;
        this.weights = weights;
    }

    /// Fits a model to historical runs.
    ///
    /// @param samples training runs, at least one, all of the same dimension, not null
    /// @param theta per-dimension correlation scales, positive, one per input dimension
    /// @return fitted model, never null
    /// @throws IllegalArgumentException on empty or inconsistent data, or a singular system
    public static KrigingSurrogateModel fit(List<TrainingSample> samples, double[] theta) {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(theta, "theta must not be null");
        if (samples.isEmpty()) {
            throw new IllegalArgumentException("at least one training sample is required");
        }
        int dimension = theta.length;
        for (double t : theta) {
            if (!(t > 0)) {
                throw new IllegalArgumentException("theta values must be positive");
            }
        }

        int n = samples.size();
        double[][] x = new double[n][];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            TrainingSample sample = samples.get(i);
            if (sample.inputs().length != dimension) {
                throw new IllegalArgumentException(
                        "sample " + i + " has " + sample.inputs().length
                                + " inputs, expected " + dimension);
            }
            x[i] = sample.inputs();
            y[i] = sample.output();
        }

        DMatrixRMaj r = new DMatrixRMaj(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                r.set(i, j, correlation(x[i], x[j], theta) + (i == j ? NUGGET : 0.0));
            }
        }
        LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.chol(n);
        if (!solver.setA(r)) {
            throw new IllegalArgumentException(
                    "correlation matrix is not positive definite; check for duplicate samples");
        }

        // column 0 solves R z = 1, column 1 solves R z = y
        DMatrixRMaj rhs = new DMatrixRMaj(n, 2);
        for (int i = 0; i < n; i++) {
            rhs.set(i, 0, 1.0);
            rhs.set(i, 1, y[i]);
        }
        DMatrixRMaj solved = new DMatrixRMaj(n, 2);
        solver.solve(rhs, solved);
        DMatrixRMaj rInvOnes = CommonOps_DDRM.extractColumn(solved, 0, null);
        DMatrixRMaj rInvY = CommonOps_DDRM.extractColumn(solved, 1, null);
        double mean = CommonOps_DDRM.elementSum(rInvY) / CommonOps_DDRM.elementSum(rInvOnes);

        // R^-1 (y - mean) = R^-1 y - mean R^-1 1
        DMatrixRMaj weights = new DMatrixRMaj(n, 1);
        CommonOps_DDRM.add(rInvY, -mean, rInvOnes, weights);

        return new KrigingSurrogateModel(x, theta.clone(), mean, weights.getData());
    }

    @Override
    public double predict(double[] parameters) {
        if (parameters.length != theta.length) {
            throw new IllegalArgumentException(
                    "expected " + theta.length + " parameters, got " + parameters.length);
        }
        double prediction = mean;
        for (int i = 0; i < inputs.length; i++) {
            prediction += correlation(parameters, inputs[i], theta) * weights[i];
        }
        return prediction;
    }

    /// Returns the fitted constant trend, the value predictions revert to far from the data.
    ///
    /// @return trend estimate
    public double getMean() {
        return mean;
    }

    private static double correlation(double[] a, double[] b, double[] theta) {
        double distance = 0;
        for (int k = 0; k < theta.length; k++) {
            double diff = a[k] - b[k];
            distance += theta[k] * diff * diff;
        }
        return Math.exp(-distance);
    }
}
