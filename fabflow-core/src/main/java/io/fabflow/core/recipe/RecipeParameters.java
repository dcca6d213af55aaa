package io.fabflow.core.recipe;

import io.fabflow.core.optimize.ParameterBound;
import io.fabflow.core.optimize.ParameterSpace;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Flat, ordered recipe of a single process step.
///
/// Values are either numbers (`Double`) or symbolic identifiers (`String`). Optimized
/// recipes carry every searched parameter followed by the achieved-metric estimate;
/// lithography recipes carry the mask file reference and the fixed sub-recipe names.
///
/// ### Contracts
/// - **Invariant**: every value is a `Double` or a `String`; map order is insertion order
/// - **Postcondition**: {@link #optimized} rejects parameters outside their bound
///
/// @param values ordered parameter map, not null
public record RecipeParameters(Map<String, Object> values) {

    public static final String ACHIEVED_THICKNESS = "achieved_thickness_nm";
    public static final String ACHIEVED_DEPTH = "achieved_depth_nm";
    public static final String MASK_FILE = "mask_file";
    public static final String RESIST_COAT_RECIPE = "resist_coat_recipe";
    public static final String EXPOSURE_RECIPE = "exposure_recipe";
    public static final String DEVELOP_RECIPE = "develop_recipe";

    public RecipeParameters {
        Objects.requireNonNull(values, "values must not be null");
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach(
                (key, value) -> {
                    Objects.requireNonNull(key, "parameter name must not be null");
                    if (value instanceof Number number) {
                        copy.put(key, number.doubleValue());
                    } else if (value instanceof String) {
                        copy.put(key, value);
                    } else {
                        throw new IllegalArgumentException(
                                "Parameter " + key + " must be a number or a string");
                    }
                });
        values = Collections.unmodifiableMap(copy);
    }

    /// Creates an optimized recipe from a parameter vector.
    ///
    /// @param space the searched space; defines names and bounds, not null
    /// @param point one value per bound, each within its bound, not null
    /// @param achievedKey name of the achieved-metric entry, not null
    /// @param achieved surrogate estimate at `point`
    /// @return new recipe, never null
    /// @throws IllegalArgumentException if a value lies outside its bound
    public static RecipeParameters optimized(
            ParameterSpace space, double[] point, String achievedKey, double achieved) {
        Objects.requireNonNull(space, "space must not be null");
        Objects.requireNonNull(point, "point must not be null");
        Objects.requireNonNull(achievedKey, "achievedKey must not be null");
        if (point.length != space.dimension()) {
            throw new IllegalArgumentException(
                    "Expected " + space.dimension() + " values, got " + point.length);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < point.length; i++) {
            ParameterBound bound = space.bound(i);
            if (!bound.contains(point[i])) {
                throw new IllegalArgumentException(
                        bound.name() + "=" + point[i] + " outside [" + bound.min() + ", "
                                + bound.max() + "]");
            }
            values.put(bound.name(), point[i]);
        }
        values.put(achievedKey, achieved);
        return new RecipeParameters(values);
    }

    /// Creates a lithography recipe.
    ///
    /// @param maskFile extracted mask file path, not null
    /// @param resistCoat resist coat sub-recipe, not null
    /// @param exposure exposure sub-recipe, not null
    /// @param develop develop sub-recipe, not null
    /// @return new recipe, never null
    public static RecipeParameters lithography(
            String maskFile, String resistCoat, String exposure, String develop) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(MASK_FILE, Objects.requireNonNull(maskFile, "maskFile must not be null"));
        values.put(RESIST_COAT_RECIPE, Objects.requireNonNull(resistCoat, "resistCoat must not be null"));
        values.put(EXPOSURE_RECIPE, Objects.requireNonNull(exposure, "exposure must not be null"));
        values.put(DEVELOP_RECIPE, Objects.requireNonNull(develop, "develop must not be null"));
        return new RecipeParameters(values);
    }

    /// Returns a numeric parameter.
    ///
    /// @param name parameter name, not null
    /// @return the value if present and numeric, empty otherwise
    public Optional<Double> numeric(String name) {
        Object value = values.get(name);
        return value instanceof Double d ? Optional.of(d) : Optional.empty();
    }

    /// Returns a symbolic parameter.
    ///
    /// @param name parameter name, not null
    /// @return the value if present and symbolic, empty otherwise
    public Optional<String> symbolic(String name) {
        Object value = values.get(name);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public Optional<String> maskFile() {
        return symbolic(MASK_FILE);
    }
}
