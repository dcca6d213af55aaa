package io.fabflow.core.optimize.surrogate;

import io.fabflow.core.optimize.SurrogateModel;
import java.util.Optional;
import java.util.Set;

/// Resolves opaque surrogate model references, as stored in a tool catalog, to fitted models.
///
/// ### Usage
/// {@snippet :
/// SurrogateModelRegistry registry = new DefaultSurrogateModelRegistry();
/// registry.register("cvd01-oxide", KrigingSurrogateModel.fit(samples, theta));
///
/// SurrogateModel model = registry.get("cvd01-oxide").orElseThrow();
/// }
///
/// @see DefaultSurrogateModelRegistry
public interface SurrogateModelRegistry {

    /// Registers a model under a reference, replacing any previous one.
    ///
    /// @param reference model reference, not null
    /// @param model fitted model, not null
    void register(String reference, SurrogateModel model);

    /// Looks up a model.
    ///
    /// @param reference model reference, not null
    /// @return the model if registered, empty otherwise
    Optional<SurrogateModel> get(String reference);

    /// Returns all registered references.
    ///
    /// @return immutable reference set, never null
    Set<String> references();
}
