package io.fabflow.core.litho;

import java.util.Objects;

/// Names of the fixed resist coat, exposure and develop recipes used by every lithography
/// step.
///
/// @param resistCoat resist coat recipe name, not null
/// @param exposure exposure recipe name, not null
/// @param develop develop recipe name, not null
public record LithographySubRecipes(String resistCoat, String exposure, String develop) {

    public LithographySubRecipes {
        Objects.requireNonNull(resistCoat, "resistCoat must not be null");
        Objects.requireNonNull(exposure, "exposure must not be null");
        Objects.requireNonNull(develop, "develop must not be null");
    }

    /// Standard 1 µm coat, 200 mJ exposure and 60 s develop.
    public static LithographySubRecipes defaults() {
        return new LithographySubRecipes(
                "STANDARD_COAT_1UM", "STANDARD_EXPOSE_200mJ", "STANDARD_DEV_60S");
    }
}
