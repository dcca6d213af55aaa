package io.fabflow.core;

import io.fabflow.core.change.ChangeDescriptorValidator;
import io.fabflow.core.classify.ClassificationThresholds;
import io.fabflow.core.classify.ProcessClassifier;
import io.fabflow.core.flow.AuxiliaryStepPolicy;
import io.fabflow.core.flow.FlowObserver;
import io.fabflow.core.flow.FlowOrchestrator;
import io.fabflow.core.litho.LithographyPlanner;
import io.fabflow.core.litho.LithographySubRecipes;
import io.fabflow.core.litho.MaskExtractor;
import io.fabflow.core.optimize.BoundedQuasiNewtonMinimizer;
import io.fabflow.core.optimize.GridSearch;
import io.fabflow.core.optimize.ParameterBound;
import io.fabflow.core.optimize.ParameterOptimizer;
import io.fabflow.core.optimize.ParameterSpace;
import io.fabflow.core.tool.DeadlineKnowledgeStore;
import io.fabflow.core.tool.KnowledgeStore;
import io.fabflow.core.tool.ToolSelector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Factory for creating and wiring {@link FabflowEnvironment} instances.
///
/// ### Usage
/// {@snippet :
/// Properties properties = new Properties();
/// properties.setProperty("fabflow.optimizer.max-iterations", "200");
///
/// try (var env = FabflowFactory.builder()
///         .config(FabflowFactory.loadConfig(properties))
///         .knowledgeStore(store)
///         .maskExtractor(extractor)
///         .build()) {
///     FlowResult result = env.getOrchestrator().plan(request);
/// }
/// }
///
/// ### Recognised Properties
/// | Key | Meaning |
/// |---|---|
/// | `fabflow.classifier.conformal-aspect-ratio` | conformal deposition threshold |
/// | `fabflow.classifier.anisotropic-aspect-ratio` | anisotropic etch threshold |
/// | `fabflow.optimizer.max-iterations` | quasi-Newton iteration cap |
/// | `fabflow.optimizer.grid-points` | fallback grid points per parameter |
/// | `fabflow.optimizer.tolerance` | convergence tolerance |
/// | `fabflow.optimizer.bounds.<name>` | `min,max` bound of a recipe parameter |
/// | `fabflow.knowledge.deadline-ms` | knowledge query deadline, `0` for none |
/// | `fabflow.wafer.substrate` | substrate material |
/// | `fabflow.litho.resist-coat`, `.exposure`, `.develop` | lithography sub-recipes |
/// | `fabflow.flow.auxiliary-policy` | `none` or `patterning-before-anisotropic-etch` |
///
/// @see FabflowConfig
/// @see Builder
public final class FabflowFactory {

    private static final Logger logger = Logger.getLogger(FabflowFactory.class.getName());

    static final String PREFIX = "fabflow.";
    static final String BOUNDS_PREFIX = "fabflow.optimizer.bounds.";

    private FabflowFactory() {}

    /// Creates an environment with explicit collaborators.
    ///
    /// @param config configuration options, not null
    /// @param knowledgeStore tool knowledge base, not null
    /// @param maskExtractor mask extraction collaborator, not null
    /// @return a fully-wired environment, never null
    public static FabflowEnvironment createEnvironment(
            FabflowConfig config, KnowledgeStore knowledgeStore, MaskExtractor maskExtractor) {
        return builder()
                .config(config)
                .knowledgeStore(knowledgeStore)
                .maskExtractor(maskExtractor)
                .build();
    }

    /// Maps `fabflow.*` properties onto a configuration.
    ///
    /// Unknown keys under the `fabflow.` prefix are logged and ignored; keys outside it are
    /// ignored silently.
    ///
    /// @param properties the properties to read, not null
    /// @return new configuration, defaults for absent keys, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static FabflowConfig loadConfig(Properties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        FabflowConfig config = new FabflowConfig();

        ClassificationThresholds thresholds = config.getClassificationThresholds();
        double conformal =
                doubleProperty(
                        properties,
                        "fabflow.classifier.conformal-aspect-ratio",
                        thresholds.conformalAspectRatio());
        double anisotropic =
                doubleProperty(
                        properties,
                        "fabflow.classifier.anisotropic-aspect-ratio",
                        thresholds.anisotropicAspectRatio());
        config.setClassificationThresholds(new ClassificationThresholds(conformal, anisotropic));

        config.setOptimizerMaxIterations(
                intProperty(
                        properties,
                        "fabflow.optimizer.max-iterations",
                        config.getOptimizerMaxIterations()));
        config.setGridPointsPerDimension(
                intProperty(
                        properties,
                        "fabflow.optimizer.grid-points",
                        config.getGridPointsPerDimension()));
        config.setConvergenceTolerance(
                doubleProperty(
                        properties, "fabflow.optimizer.tolerance", config.getConvergenceTolerance()));

        ParameterSpace space = config.getParameterSpace();
        for (String key : new TreeSet<>(properties.stringPropertyNames())) {
            if (key.startsWith(BOUNDS_PREFIX)) {
                String name = key.substring(BOUNDS_PREFIX.length());
                space = space.with(parseBound(name, properties.getProperty(key)));
            }
        }
        config.setParameterSpace(space);

        long deadlineMs = intProperty(properties, "fabflow.knowledge.deadline-ms", 0);
        config.setKnowledgeQueryDeadline(Duration.ofMillis(deadlineMs));

        config.setSubstrate(
                properties.getProperty("fabflow.wafer.substrate", config.getSubstrate()).trim());

        LithographySubRecipes litho = config.getLithographySubRecipes();
        String resistCoat = properties.getProperty("fabflow.litho.resist-coat", litho.resistCoat());
        String exposure = properties.getProperty("fabflow.litho.exposure", litho.exposure());
        String develop = properties.getProperty("fabflow.litho.develop", litho.develop());
        config.setLithographySubRecipes(
                new LithographySubRecipes(resistCoat.trim(), exposure.trim(), develop.trim()));

        config.setAuxiliaryPolicy(
                properties
                        .getProperty("fabflow.flow.auxiliary-policy", config.getAuxiliaryPolicy())
                        .trim());

        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(PREFIX) && !isKnownKey(key)) {
                logger.warning("Ignoring unknown configuration key: " + key);
            }
        }
        return config;
    }

    /// Resolves a policy name to an {@link AuxiliaryStepPolicy}.
    ///
    /// @param name policy name, not null
    /// @return the policy, never null
    /// @throws IllegalArgumentException for unknown names
    public static AuxiliaryStepPolicy auxiliaryPolicy(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return switch (name) {
            case FabflowConfig.AUXILIARY_NONE -> AuxiliaryStepPolicy.none();
            case FabflowConfig.AUXILIARY_PATTERNING ->
                    AuxiliaryStepPolicy.patterningBeforeAnisotropicEtch();
            default -> throw new IllegalArgumentException("Unknown auxiliary policy: " + name);
        };
    }

    private static boolean isKnownKey(String key) {
        return key.startsWith(BOUNDS_PREFIX)
                || switch (key) {
                    case "fabflow.classifier.conformal-aspect-ratio",
                            "fabflow.classifier.anisotropic-aspect-ratio",
                            "fabflow.optimizer.max-iterations",
                            "fabflow.optimizer.grid-points",
                            "fabflow.optimizer.tolerance",
                            "fabflow.knowledge.deadline-ms",
                            "fabflow.wafer.substrate",
                            "fabflow.litho.resist-coat",
                            "fabflow.litho.exposure",
                            "fabflow.litho.develop",
                            "fabflow.flow.auxiliary-policy" -> true;
                    default -> false;
                };
    }

    private static ParameterBound parseBound(String name, String value) {
        String[] parts = value.split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException(
                    "Bound for " + name + " must be 'min,max', was '" + value + "'");
        }
        try {
            return new ParameterBound(
                    name, Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid bound for " + name + ": " + value, e);
        }
    }

    private static double doubleProperty(Properties properties, String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    /// Creates a new builder for fluent environment configuration.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link FabflowEnvironment} instances.
    ///
    /// @implNote **Not thread-safe**. Configure on one thread, then call {@link #build()}.
    public static class Builder {
        private FabflowConfig config = new FabflowConfig();
        private KnowledgeStore knowledgeStore;
        private MaskExtractor maskExtractor;
        private AuxiliaryStepPolicy auxiliaryStepPolicy;
        private final List<FlowObserver> observers = new ArrayList<>();

        public Builder config(FabflowConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder knowledgeStore(KnowledgeStore knowledgeStore) {
            this.knowledgeStore = knowledgeStore;
            return this;
        }

        public Builder maskExtractor(MaskExtractor maskExtractor) {
            this.maskExtractor = maskExtractor;
            return this;
        }

        /// Overrides the policy named in the configuration.
        ///
        /// @param policy the policy, may be null to use the configured name
        /// @return this builder for chaining, never null
        public Builder auxiliaryStepPolicy(AuxiliaryStepPolicy policy) {
            this.auxiliaryStepPolicy = policy;
            return this;
        }

        public Builder observer(FlowObserver observer) {
            this.observers.add(Objects.requireNonNull(observer, "observer must not be null"));
            return this;
        }

        /// Builds the environment.
        ///
        /// @apiNote **Side effects**: creates a single-thread executor when the configuration
        /// sets a knowledge query deadline; the environment shuts it down on close.
        ///
        /// @return the configured environment, never null
        /// @throws NullPointerException if no knowledge store or mask extractor was set
        public FabflowEnvironment build() {
            Objects.requireNonNull(knowledgeStore, "knowledgeStore must not be null");
            Objects.requireNonNull(maskExtractor, "maskExtractor must not be null");

            ExecutorService queryExecutor = null;
            KnowledgeStore store = knowledgeStore;
            if (config.hasKnowledgeQueryDeadline()) {
                queryExecutor =
                        Executors.newSingleThreadExecutor(
                                runnable -> {
                                    Thread thread = new Thread(runnable, "fabflow-knowledge-query");
                                    thread.setDaemon(true);
                                    return thread;
                                });
                store =
                        new DeadlineKnowledgeStore(
                                knowledgeStore, config.getKnowledgeQueryDeadline(), queryExecutor);
            }

            ProcessClassifier classifier =
                    ProcessClassifier.standard(config.getClassificationThresholds());
            ToolSelector toolSelector = new ToolSelector(store);
            ParameterOptimizer optimizer =
                    new ParameterOptimizer(
                            config.getParameterSpace(),
                            new BoundedQuasiNewtonMinimizer(
                                    config.getOptimizerMaxIterations(),
                                    config.getConvergenceTolerance()),
                            new GridSearch(config.getGridPointsPerDimension()));
            LithographyPlanner lithographyPlanner =
                    new LithographyPlanner(maskExtractor, config.getLithographySubRecipes());
            AuxiliaryStepPolicy policy =
                    auxiliaryStepPolicy != null
                            ? auxiliaryStepPolicy
                            : auxiliaryPolicy(config.getAuxiliaryPolicy());

            FlowOrchestrator orchestrator =
                    new FlowOrchestrator(
                            new ChangeDescriptorValidator(),
                            classifier,
                            toolSelector,
                            optimizer,
                            lithographyPlanner,
                            policy,
                            config.getSubstrate());
            observers.forEach(orchestrator::addObserver);

            return new FabflowEnvironment(
                    orchestrator, classifier, toolSelector, optimizer, store, config, queryExecutor);
        }
    }
}
