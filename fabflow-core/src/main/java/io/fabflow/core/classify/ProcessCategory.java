package io.fabflow.core.classify;

import java.util.Locale;

/// Manufacturing process families the planner can emit.
public enum ProcessCategory {
    DEPOSITION("Deposition"),
    ETCH("Etch"),
    LITHOGRAPHY("Lithography"),
    /// No rule matched; the change cannot be planned.
    UNKNOWN("Unknown");

    private final String displayName;

    ProcessCategory(String displayName) {
        this.displayName = displayName;
    }

    /// Returns the name written to the `process_type` field of an emitted step.
    ///
    /// @return display name, never null
    public String displayName() {
        return displayName;
    }

    /// Resolves a category from its display name or constant name, case-insensitively.
    ///
    /// @param label e.g. `"Deposition"` or `"ETCH"`, not null
    /// @return the matching category, never null
    /// @throws IllegalArgumentException if the label names no category
    public static ProcessCategory fromLabel(String label) {
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (ProcessCategory category : values()) {
            if (category.name().equals(normalized)
                    || category.displayName.toUpperCase(Locale.ROOT).equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown process category: " + label);
    }
}
