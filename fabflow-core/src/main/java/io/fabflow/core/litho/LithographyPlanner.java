package io.fabflow.core.litho;

import io.fabflow.core.recipe.RecipeParameters;
import java.util.Objects;
import java.util.logging.Logger;

/// Builds lithography recipes.
///
/// Lithography has no continuous parameters to search: its recipe is the fixed
/// {@link LithographySubRecipes} plus a mask file obtained from the {@link MaskExtractor}.
///
/// @see io.fabflow.core.optimize.ParameterOptimizer for deposition and etch
public final class LithographyPlanner {

    private static final Logger logger = Logger.getLogger(LithographyPlanner.class.getName());

    private final MaskExtractor maskExtractor;
    private final LithographySubRecipes subRecipes;

    public LithographyPlanner(MaskExtractor maskExtractor, LithographySubRecipes subRecipes) {
        this.maskExtractor = Objects.requireNonNull(maskExtractor, "maskExtractor must not be null");
        this.subRecipes = Objects.requireNonNull(subRecipes, "subRecipes must not be null");
    }

    /// Plans the recipe of one lithography step.
    ///
    /// @param stepIdentifier lithography step identifier, not null
    /// @param layoutReference layout the mask is cut from, not null
    /// @return recipe carrying the mask file and sub-recipes, never null
    /// @throws MaskServiceUnavailableException if the mask cannot be extracted
    public RecipeParameters plan(String stepIdentifier, String layoutReference)
            throws MaskServiceUnavailableException {
        Objects.requireNonNull(stepIdentifier, "stepIdentifier must not be null");
        Objects.requireNonNull(layoutReference, "layoutReference must not be null");

        String maskFile = maskExtractor.extractMask(layoutReference, stepIdentifier);
        if (maskFile == null || maskFile.isBlank()) {
            throw new MaskServiceUnavailableException(
                    "Mask service returned no mask file for step " + stepIdentifier);
        }
        logger.info("Extracted mask " + maskFile + " for " + stepIdentifier);
        return RecipeParameters.lithography(
                maskFile, subRecipes.resistCoat(), subRecipes.exposure(), subRecipes.develop());
    }
}
