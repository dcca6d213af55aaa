package io.fabflow.core.change;

/// Standard wafer diameters a tool chamber can accept.
public enum WaferSize {
    MM_150(150),
    MM_200(200),
    MM_300(300),
    MM_450(450);

    private final int millimeters;

    WaferSize(int millimeters) {
        this.millimeters = millimeters;
    }

    /// Returns the nominal wafer diameter.
    ///
    /// @return diameter in millimeters
    public int millimeters() {
        return millimeters;
    }

    /// Resolves a wafer size from its diameter.
    ///
    /// @param millimeters nominal diameter in millimeters
    /// @return the matching size, never null
    /// @throws IllegalArgumentException if no standard size has this diameter
    public static WaferSize ofMillimeters(int millimeters) {
        for (WaferSize size : values()) {
            if (size.millimeters == millimeters) {
                return size;
            }
        }
        throw new IllegalArgumentException("Unsupported wafer size: " + millimeters + " mm");
    }
}
