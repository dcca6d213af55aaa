package io.fabflow.core.optimize;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Ordered box of {@link ParameterBound}s searched by the optimizer.
///
/// The order of the bounds defines the order of values in every parameter vector handed to
/// a {@link SurrogateModel}.
///
/// ### Contracts
/// - **Precondition**: at least one bound; names unique
/// - **Postcondition**: immutable after construction
///
/// @param bounds ordered parameter bounds, not null or empty
public record ParameterSpace(List<ParameterBound> bounds) {

    public ParameterSpace {
        Objects.requireNonNull(bounds, "bounds must not be null");
        if (bounds.isEmpty()) {
            throw new IllegalArgumentException("parameter space needs at least one bound");
        }
        long distinct = bounds.stream().map(ParameterBound::name).distinct().count();
        if (distinct != bounds.size()) {
            throw new IllegalArgumentException("parameter names must be unique");
        }
        bounds = List.copyOf(bounds);
    }

    /// Returns the documented process window: `time_s` in `[5, 30]` and `pressure_torr` in
    /// `[0.5, 3.0]`.
    ///
    /// @return default space, never null
    public static ParameterSpace defaults() {
        return new ParameterSpace(
                List.of(
                        new ParameterBound("time_s", 5.0, 30.0),
                        new ParameterBound("pressure_torr", 0.5, 3.0)));
    }

    /// Returns a copy with `bound` replacing the bound of the same name, or appended if the
    /// name is new.
    ///
    /// @param bound the bound to set, not null
    /// @return new space, never null
    public ParameterSpace with(ParameterBound bound) {
        Objects.requireNonNull(bound, "bound must not be null");
        List<ParameterBound> updated = new ArrayList<>(bounds);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).name().equals(bound.name())) {
                updated.set(i, bound);
                return new ParameterSpace(updated);
            }
        }
        updated.add(bound);
        return new ParameterSpace(updated);
    }

    public int dimension() {
        return bounds.size();
    }

    public ParameterBound bound(int index) {
        return bounds.get(index);
    }

    /// Returns the center of the box, the deterministic optimizer seed.
    ///
    /// @return new midpoint vector, never null
    public double[] midpoint() {
        double[] point = new double[bounds.size()];
        for (int i = 0; i < point.length; i++) {
            point[i] = bounds.get(i).midpoint();
        }
        return point;
    }

    public boolean contains(double[] point) {
        if (point.length != bounds.size()) {
            return false;
        }
        for (int i = 0; i < point.length; i++) {
            if (!bounds.get(i).contains(point[i])) {
                return false;
            }
        }
        return true;
    }

    /// Maps a point of the unit box `[0, 1]^n` onto this space, clamping to the bounds.
    ///
    /// @param unit normalized coordinates, not null
    /// @return new point in parameter units, never null
    public double[] fromUnit(double[] unit) {
        double[] point = new double[unit.length];
        for (int i = 0; i < unit.length; i++) {
            ParameterBound bound = bounds.get(i);
            point[i] = bound.clamp(bound.min() + unit[i] * bound.width());
        }
        return point;
    }

    /// Maps a point of this space onto the unit box. Degenerate bounds map to `0`.
    ///
    /// @param point parameter values, not null
    /// @return new normalized point, never null
    public double[] toUnit(double[] point) {
        double[] unit = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            ParameterBound bound = bounds.get(i);
            unit[i] = bound.width() == 0 ? 0.0 : (bound.clamp(point[i]) - bound.min()) / bound.width();
        }
        return unit;
    }
}
