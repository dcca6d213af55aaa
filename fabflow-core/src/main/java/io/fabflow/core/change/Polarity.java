package io.fabflow.core.change;

import java.util.Locale;

/// Direction of a detected material change between two consecutive stages.
public enum Polarity {
    /// Material appeared (layer grown or deposited).
    ADDITION,
    /// Material disappeared (layer etched or stripped).
    REMOVAL;

    /// Parses a polarity label, case-insensitively.
    ///
    /// @param label textual polarity such as `"addition"` or `"REMOVAL"`, may be null
    /// @return the matching polarity, or `null` for a null or blank label
    /// @throws IllegalArgumentException if the label names no polarity
    public static Polarity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
