package io.fabflow.core.flow;

import io.fabflow.core.classify.ProcessCategory;
import io.fabflow.core.recipe.RecipeParameters;
import java.util.Objects;

/// One manufacturing step of a {@link ProcessFlow}.
///
/// ### Contracts
/// - **Precondition**: `stepNumber >= 1`; category is DEPOSITION, ETCH or LITHOGRAPHY
/// - **Invariant**: immutable
///
/// @param stepNumber 1-based position in the flow
/// @param category process category of the step, not null
/// @param toolId tool running the step, not null
/// @param recipeParameters recipe for the tool, not null
/// @param sourceOrderIndex order index of the originating change, `-1` for injected steps
public record ProcessStep(
        int stepNumber,
        ProcessCategory category,
        String toolId,
        RecipeParameters recipeParameters,
        int sourceOrderIndex) {

    /// Order index marking a step that no change descriptor asked for.
    public static final int INJECTED = -1;

    public ProcessStep {
        if (stepNumber < 1) {
            throw new IllegalArgumentException("stepNumber must be >= 1, was " + stepNumber);
        }
        Objects.requireNonNull(category, "category must not be null");
        if (category == ProcessCategory.UNKNOWN) {
            throw new IllegalArgumentException("An UNKNOWN change never becomes a step");
        }
        Objects.requireNonNull(toolId, "toolId must not be null");
        Objects.requireNonNull(recipeParameters, "recipeParameters must not be null");
    }

    /// Returns the process type label, the category's display name.
    ///
    /// @return e.g. `"Deposition"`, never null
    public String processType() {
        return category.displayName();
    }

    public boolean isInjected() {
        return sourceOrderIndex == INJECTED;
    }

    /// Returns a copy carrying a different step number.
    ///
    /// @param newStepNumber the new 1-based number
    /// @return new step, never null
    public ProcessStep withStepNumber(int newStepNumber) {
        return new ProcessStep(newStepNumber, category, toolId, recipeParameters, sourceOrderIndex);
    }
}
