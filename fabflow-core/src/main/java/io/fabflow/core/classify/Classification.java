package io.fabflow.core.classify;

import java.util.Objects;

/// Outcome of classifying one change: a process category plus an optional subtype.
///
/// @param category the process family, not null
/// @param subtype the geometric refinement, may be null (lithography and unknown changes)
public record Classification(ProcessCategory category, ProcessSubtype subtype) {

    private static final Classification UNKNOWN = new Classification(ProcessCategory.UNKNOWN, null);

    public Classification {
        Objects.requireNonNull(category, "category must not be null");
    }

    public static Classification of(ProcessCategory category, ProcessSubtype subtype) {
        return new Classification(category, subtype);
    }

    public static Classification lithography() {
        return new Classification(ProcessCategory.LITHOGRAPHY, null);
    }

    public static Classification unknown() {
        return UNKNOWN;
    }

    public boolean isUnknown() {
        return category == ProcessCategory.UNKNOWN;
    }

    public boolean isLithography() {
        return category == ProcessCategory.LITHOGRAPHY;
    }

    @Override
    public String toString() {
        return subtype == null ? category.name() : category.name() + "/" + subtype.name();
    }
}
