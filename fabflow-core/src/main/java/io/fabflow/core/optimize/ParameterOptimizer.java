package io.fabflow.core.optimize;

import io.fabflow.core.change.ChangeDescriptor;
import io.fabflow.core.classify.Classification;
import io.fabflow.core.classify.ProcessCategory;
import io.fabflow.core.recipe.RecipeParameters;
import io.fabflow.core.tool.ToolRecord;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import java.util.logging.Logger;

/// Finds recipe parameters whose predicted outcome matches a change's target metric.
///
/// The objective is the squared deviation `(predict(x) - target)^2` of the tool's
/// {@link SurrogateModel}. A {@link BoundedQuasiNewtonMinimizer} runs from the midpoint of
/// the {@link ParameterSpace}; if it does not converge within its iteration budget, a
/// {@link GridSearch} over the box is evaluated and the better of the two points is kept.
///
/// ### Contracts
/// - **Precondition**: the tool carries a surrogate model; the category is DEPOSITION or ETCH
/// - **Postcondition**: every returned parameter lies within its bound, for any target,
///   including unreachable ones
/// - **Postcondition**: identical inputs produce identical recipes
///
/// Lithography never reaches this class; it is planned by
/// {@link io.fabflow.core.litho.LithographyPlanner}.
///
/// @implNote Stateless apart from its immutable configuration. Surrogate models are not
/// assumed thread-safe, so concurrent calls must not share a tool.
public final class ParameterOptimizer {

    private static final Logger logger = Logger.getLogger(ParameterOptimizer.class.getName());

    private final ParameterSpace space;
    private final BoundedQuasiNewtonMinimizer minimizer;
    private final GridSearch fallback;

    /// Creates an optimizer.
    ///
    /// @param space parameter bounds, not null
    /// @param minimizer primary local search, not null
    /// @param fallback grid evaluated on non-convergence, not null
    public ParameterOptimizer(
            ParameterSpace space, BoundedQuasiNewtonMinimizer minimizer, GridSearch fallback) {
        this.space = Objects.requireNonNull(space, "space must not be null");
        this.minimizer = Objects.requireNonNull(minimizer, "minimizer must not be null");
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
    }

    /// Optimizes recipe parameters for one change on one tool.
    ///
    /// @param tool the selected tool, must carry a surrogate model, not null
    /// @param classification DEPOSITION or ETCH classification, not null
    /// @param descriptor the change providing the target metric, not null
    /// @return bounded recipe with the achieved-metric estimate, never null
    /// @throws IllegalArgumentException if the category is not optimizable
    /// @throws IllegalStateException if the tool has no surrogate model
    public RecipeParameters optimize(
            ToolRecord tool, Classification classification, ChangeDescriptor descriptor) {
        Objects.requireNonNull(tool, "tool must not be null");
        Objects.requireNonNull(classification, "classification must not be null");
        Objects.requireNonNull(descriptor, "descriptor must not be null");

        String achievedKey = achievedKey(classification.category());
        SurrogateModel model = tool.surrogateModel();
        if (model == null) {
            throw new IllegalStateException("Tool " + tool.toolId() + " has no surrogate model");
        }

        double target = descriptor.targetMetric();
        ToDoubleFunction<double[]> objective =
                x -> {
                    double deviation = model.predict(x) - target;
                    return deviation * deviation;
                };

        MinimizationResult result = minimizer.minimize(objective, space, space.midpoint());
        if (!result.converged()) {
            MinimizationResult grid = fallback.search(objective, space);
            logger.warning(
                    "Optimizer did not converge for tool " + tool.toolId() + " after "
                            + result.iterations() + " iterations; using grid fallback");
            if (!(result.value() <= grid.value())) {
                result = grid;
            }
        }

        double[] point = result.point();
        double achieved = model.predict(point);
        logger.fine(
                "Optimized " + tool.toolId() + " for target " + target + " nm: achieved "
                        + achieved + " nm");
        return RecipeParameters.optimized(space, point, achievedKey, achieved);
    }

    public ParameterSpace getSpace() {
        return space;
    }

    private static String achievedKey(ProcessCategory category) {
        return switch (category) {
            case DEPOSITION -> RecipeParameters.ACHIEVED_THICKNESS;
            case ETCH -> RecipeParameters.ACHIEVED_DEPTH;
            default -> throw new IllegalArgumentException(
                    "Cannot optimize parameters for " + category);
        };
    }
}
