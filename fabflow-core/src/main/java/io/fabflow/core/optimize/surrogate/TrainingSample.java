package io.fabflow.core.optimize.surrogate;

import java.util.Arrays;
import java.util.Objects;

/// One historical process run: the parameters used and the metric measured.
///
/// Equality compares input values, not array identity.
///
/// @param inputs parameter values in parameter-space order, not null or empty
/// @param output measured metric in nanometers
public record TrainingSample(double[] inputs, double output) {

    public TrainingSample {
        Objects.requireNonNull(inputs, "inputs must not be null");
        if (inputs.length == 0) {
            throw new IllegalArgumentException("inputs must not be empty");
        }
        inputs = inputs.clone();
    }

    @Override
    public double[] inputs() {
        return inputs.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TrainingSample other)) {
            return false;
        }
        return Double.compare(output, other.output) == 0 && Arrays.equals(inputs, other.inputs);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(inputs) + Double.hashCode(output);
    }

    @Override
    public String toString() {
        return "TrainingSample[inputs=" + Arrays.toString(inputs) + ", output=" + output + "]";
    }

    public static TrainingSample of(double output, double... inputs) {
        return new TrainingSample(inputs, output);
    }
}
