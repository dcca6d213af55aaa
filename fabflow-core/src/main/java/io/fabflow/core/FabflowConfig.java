package io.fabflow.core;

import io.fabflow.core.classify.ClassificationThresholds;
import io.fabflow.core.litho.LithographySubRecipes;
import io.fabflow.core.optimize.ParameterSpace;
import java.time.Duration;

/// Configuration options for the planning engine.
///
/// ### Default Values
/// - `classificationThresholds`: conformal above aspect ratio 5, anisotropic below 0.5
/// - `parameterSpace`: `time_s` in [5, 30], `pressure_torr` in [0.5, 3.0]
/// - `optimizerMaxIterations`: `100`
/// - `gridPointsPerDimension`: `11`
/// - `convergenceTolerance`: `1e-6`
/// - `knowledgeQueryDeadline`: `Duration.ZERO` (no deadline)
/// - `substrate`: `"silicon"`
/// - `lithographySubRecipes`: {@link LithographySubRecipes#defaults()}
/// - `auxiliaryPolicy`: `"none"`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link FabflowFactory} and do
/// not modify afterwards.
///
/// @see FabflowFactory#loadConfig(java.util.Properties)
/// @see Builder
public class FabflowConfig {

    /// Auxiliary policy name disabling step injection.
    public static final String AUXILIARY_NONE = "none";

    /// Auxiliary policy name injecting lithography before anisotropic etches.
    public static final String AUXILIARY_PATTERNING = "patterning-before-anisotropic-etch";

    private ClassificationThresholds classificationThresholds = ClassificationThresholds.defaults();
    private ParameterSpace parameterSpace = ParameterSpace.defaults();
    private int optimizerMaxIterations = 100;
    private int gridPointsPerDimension = 11;
    private double convergenceTolerance = 1e-6;
    private Duration knowledgeQueryDeadline = Duration.ZERO;
    private String substrate = "silicon";
    private LithographySubRecipes lithographySubRecipes = LithographySubRecipes.defaults();
    private String auxiliaryPolicy = AUXILIARY_NONE;

    /// Creates a configuration with default values.
    public FabflowConfig() {}

    public ClassificationThresholds getClassificationThresholds() {
        return classificationThresholds;
    }

    public void setClassificationThresholds(ClassificationThresholds classificationThresholds) {
        this.classificationThresholds = classificationThresholds;
    }

    public ParameterSpace getParameterSpace() {
        return parameterSpace;
    }

    public void setParameterSpace(ParameterSpace parameterSpace) {
        this.parameterSpace = parameterSpace;
    }

    /// Returns the hard iteration cap of the quasi-Newton minimizer.
    ///
    /// @return positive iteration count
    public int getOptimizerMaxIterations() {
        return optimizerMaxIterations;
    }

    public void setOptimizerMaxIterations(int optimizerMaxIterations) {
        this.optimizerMaxIterations = optimizerMaxIterations;
    }

    /// Returns the number of grid points per parameter used by the fallback search.
    ///
    /// @return points per dimension, at least 2
    public int getGridPointsPerDimension() {
        return gridPointsPerDimension;
    }

    public void setGridPointsPerDimension(int gridPointsPerDimension) {
        this.gridPointsPerDimension = gridPointsPerDimension;
    }

    public double getConvergenceTolerance() {
        return convergenceTolerance;
    }

    public void setConvergenceTolerance(double convergenceTolerance) {
        this.convergenceTolerance = convergenceTolerance;
    }

    /// Returns the maximum wait for a knowledge store query.
    ///
    /// @return deadline, `Duration.ZERO` when queries are not bounded, never null
    public Duration getKnowledgeQueryDeadline() {
        return knowledgeQueryDeadline;
    }

    public void setKnowledgeQueryDeadline(Duration knowledgeQueryDeadline) {
        this.knowledgeQueryDeadline = knowledgeQueryDeadline;
    }

    public boolean hasKnowledgeQueryDeadline() {
        return knowledgeQueryDeadline != null
                && !knowledgeQueryDeadline.isZero()
                && !knowledgeQueryDeadline.isNegative();
    }

    public String getSubstrate() {
        return substrate;
    }

    public void setSubstrate(String substrate) {
        this.substrate = substrate;
    }

    public LithographySubRecipes getLithographySubRecipes() {
        return lithographySubRecipes;
    }

    public void setLithographySubRecipes(LithographySubRecipes lithographySubRecipes) {
        this.lithographySubRecipes = lithographySubRecipes;
    }

    /// Returns the name of the auxiliary step policy.
    ///
    /// @return {@link #AUXILIARY_NONE} or {@link #AUXILIARY_PATTERNING}, never null
    public String getAuxiliaryPolicy() {
        return auxiliaryPolicy;
    }

    public void setAuxiliaryPolicy(String auxiliaryPolicy) {
        this.auxiliaryPolicy = auxiliaryPolicy;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link FabflowConfig}.
    ///
    /// @implNote Mutates a single config instance and returns it on {@link #build()}.
    public static class Builder {
        private final FabflowConfig config = new FabflowConfig();

        public Builder classificationThresholds(ClassificationThresholds thresholds) {
            config.classificationThresholds = thresholds;
            return this;
        }

        public Builder parameterSpace(ParameterSpace parameterSpace) {
            config.parameterSpace = parameterSpace;
            return this;
        }

        public Builder optimizerMaxIterations(int optimizerMaxIterations) {
            config.optimizerMaxIterations = optimizerMaxIterations;
            return this;
        }

        public Builder gridPointsPerDimension(int gridPointsPerDimension) {
            config.gridPointsPerDimension = gridPointsPerDimension;
            return this;
        }

        public Builder convergenceTolerance(double convergenceTolerance) {
            config.convergenceTolerance = convergenceTolerance;
            return this;
        }

        /// Bounds every knowledge store query by a deadline.
        ///
        /// @param deadline maximum wait, `Duration.ZERO` to disable, not null
        /// @return this builder for chaining, never null
        public Builder knowledgeQueryDeadline(Duration deadline) {
            config.knowledgeQueryDeadline = deadline;
            return this;
        }

        public Builder substrate(String substrate) {
            config.substrate = substrate;
            return this;
        }

        public Builder lithographySubRecipes(LithographySubRecipes subRecipes) {
            config.lithographySubRecipes = subRecipes;
            return this;
        }

        public Builder auxiliaryPolicy(String auxiliaryPolicy) {
            config.auxiliaryPolicy = auxiliaryPolicy;
            return this;
        }

        /// Builds and returns the configured instance.
        ///
        /// @return the configured instance, never null
        public FabflowConfig build() {
            return config;
        }
    }
}
