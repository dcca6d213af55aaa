package io.fabflow.core.optimize;

import java.util.Objects;

/// Closed interval a named recipe parameter must stay within.
///
/// @param name recipe parameter name, e.g. `time_s`, not null or blank
/// @param min inclusive lower bound
/// @param max inclusive upper bound, `>= min`
public record ParameterBound(String name, double min, double max) {

    public ParameterBound {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (!Double.isFinite(min) || !Double.isFinite(max) || min > max) {
            throw new IllegalArgumentException(
                    "Invalid bound for " + name + ": [" + min + ", " + max + "]");
        }
    }

    public boolean contains(double value) {
        return (min <= value) && (value <= max);
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public double midpoint() {
        return min + (max - min) / 2.0;
    }

    public double width() {
        return max - min;
    }
}
