package io.fabflow.core.optimize;

import java.util.Objects;
import java.util.function.ToDoubleFunction;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;
import org.ejml.dense.row.mult.VectorVectorMult_DDRM;

/// Box-constrained quasi-Newton minimizer (projected BFGS).
///
/// Works on the unit box so parameters with very different scales (seconds vs. torr) are
/// treated evenly. Gradients are central finite differences, falling back to one-sided
/// differences on a bound. Each iteration takes a projected BFGS step with Armijo
/// backtracking; the inverse Hessian estimate is reset to identity whenever the step is not a
/// descent direction or the line search fails.
///
/// ### Stopping
/// - **Converged**: infinity norm of the projected gradient below
///   `tolerance * (1 + |f|)`, or `f` itself below `tolerance^2`
/// - **Not converged**: iteration budget exhausted, or line search failing along steepest
///   descent
///
/// The budget is a hard cap on iterations; it bounds work, not time.
///
/// @implNote Stateless and thread-safe; the objective itself may not be.
public final class BoundedQuasiNewtonMinimizer {

    private static final double STEP = 1e-6;
    private static final double ARMIJO = 1e-4;
    private static final int MAX_BACKTRACKS = 40;

    private final int maxIterations;
    private final double tolerance;

    /// Creates a minimizer.
    ///
    /// @param maxIterations hard iteration cap, must be positive
    /// @param tolerance projected-gradient tolerance, must be positive
    public BoundedQuasiNewtonMinimizer(int maxIterations, double tolerance) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be > 0");
        }
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("tolerance must be > 0");
        }
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    /// Minimizes `objective` over `space` starting from `start`.
    ///
    /// @param objective function of a parameter vector, not null
    /// @param space search box, not null
    /// @param start seed point in parameter units (projected into the box), not null
    /// @return best point visited, always within bounds, never null
    public MinimizationResult minimize(
            ToDoubleFunction<double[]> objective, ParameterSpace space, double[] start) {
        Objects.requireNonNull(objective, "objective must not be null");
        Objects.requireNonNull(space, "space must not be null");
        Objects.requireNonNull(start, "start must not be null");

        int n = space.dimension();
        ToDoubleFunction<DMatrixRMaj> f =
                unit -> objective.applyAsDouble(space.fromUnit(unit.getData()));

        DMatrixRMaj u = project(DMatrixRMaj.wrap(n, 1, space.toUnit(start)));
        double fu = f.applyAsDouble(u);
        DMatrixRMaj g = gradient(f, u, fu);
        DMatrixRMaj h = CommonOps_DDRM.identity(n);

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            DMatrixRMaj pg = projectedGradient(u, g);
            if (fu < tolerance * tolerance
                    || CommonOps_DDRM.elementMaxAbs(pg) < tolerance * (1 + Math.abs(fu))) {
                return new MinimizationResult(space.fromUnit(u.getData()), fu, iteration, true);
            }

            DMatrixRMaj d = new DMatrixRMaj(n, 1);
            CommonOps_DDRM.mult(-1.0, h, pg, d);
            if (VectorVectorMult_DDRM.innerProd(d, pg) >= 0) {
                h = CommonOps_DDRM.identity(n);
                CommonOps_DDRM.scale(-1.0, pg, d);
            }

            DMatrixRMaj next = null;
            double fNext = fu;
            double alpha = 1.0;
            DMatrixRMaj candidate = new DMatrixRMaj(n, 1);
            DMatrixRMaj step = new DMatrixRMaj(n, 1);
            for (int k = 0; k < MAX_BACKTRACKS; k++) {
                CommonOps_DDRM.add(u, alpha, d, candidate);
                project(candidate);
                CommonOps_DDRM.subtract(candidate, u, step);
                double fCandidate = f.applyAsDouble(candidate);
                if (fCandidate <= fu + ARMIJO * VectorVectorMult_DDRM.innerProd(g, step)) {
                    next = candidate;
                    fNext = fCandidate;
                    break;
                }
                alpha *= 0.5;
            }

            if (next == null) {
                if (MatrixFeatures_DDRM.isIdentity(h, 0.0)) {
                    // no descent along the projected steepest direction either
                    return new MinimizationResult(
                            space.fromUnit(u.getData()), fu, iteration, false);
                }
                h = CommonOps_DDRM.identity(n);
                continue;
            }

            DMatrixRMaj gNext = gradient(f, next, fNext);
            DMatrixRMaj y = new DMatrixRMaj(n, 1);
            CommonOps_DDRM.subtract(gNext, g, y);
            double sy = VectorVectorMult_DDRM.innerProd(step, y);
            if (sy > 1e-12) {
                bfgsUpdate(h, step, y, sy);
            }

            u = next;
            fu = fNext;
            g = gNext;
        }

        DMatrixRMaj pg = projectedGradient(u, g);
        boolean converged = CommonOps_DDRM.elementMaxAbs(pg) < tolerance * (1 + Math.abs(fu));
        return new MinimizationResult(space.fromUnit(u.getData()), fu, maxIterations, converged);
    }

    private static DMatrixRMaj gradient(ToDoubleFunction<DMatrixRMaj> f, DMatrixRMaj u, double fu) {
        int n = u.getNumElements();
        DMatrixRMaj g = new DMatrixRMaj(n, 1);
        for (int i = 0; i < n; i++) {
            double ui = u.get(i);
            DMatrixRMaj forward = u.copy();
            DMatrixRMaj backward = u.copy();
            if (ui + STEP <= 1.0 && ui - STEP >= 0.0) {
                forward.set(i, ui + STEP);
                backward.set(i, ui - STEP);
                g.set(i, (f.applyAsDouble(forward) - f.applyAsDouble(backward)) / (2 * STEP));
            } else if (ui + STEP <= 1.0) {
                forward.set(i, ui + STEP);
                g.set(i, (f.applyAsDouble(forward) - fu) / STEP);
            } else {
                backward.set(i, ui - STEP);
                g.set(i, (fu - f.applyAsDouble(backward)) / STEP);
            }
        }
        return g;
    }

    /// Zeroes gradient components that would push an active bound outward.
    private static DMatrixRMaj projectedGradient(DMatrixRMaj u, DMatrixRMaj g) {
        DMatrixRMaj pg = g.copy();
        for (int i = 0; i < u.getNumElements(); i++) {
            if ((u.get(i) <= 0.0 && g.get(i) > 0) || (u.get(i) >= 1.0 && g.get(i) < 0)) {
                pg.set(i, 0.0);
            }
        }
        return pg;
    }

    /// Applies the inverse-Hessian BFGS update
    /// `H += (rho^2 y'Hy + rho) ss' - rho (Hy s' + s (Hy)')` in place.
    private static void bfgsUpdate(DMatrixRMaj h, DMatrixRMaj s, DMatrixRMaj y, double sy) {
        double rho = 1.0 / sy;
        DMatrixRMaj hy = new DMatrixRMaj(s.getNumRows(), 1);
        CommonOps_DDRM.mult(h, y, hy);
        double yhy = VectorVectorMult_DDRM.innerProd(y, hy);
        CommonOps_DDRM.multAddTransB(-rho, hy, s, h);
        CommonOps_DDRM.multAddTransB(-rho, s, hy, h);
        CommonOps_DDRM.multAddTransB(rho * rho * yhy + rho, s, s, h);
    }

    /// Clamps every coordinate into the unit interval in place.
    private static DMatrixRMaj project(DMatrixRMaj u) {
        for (int i = 0; i < u.getNumElements(); i++) {
            u.set(i, Math.max(0.0, Math.min(1.0, u.get(i))));
        }
        return u;
    }
}
