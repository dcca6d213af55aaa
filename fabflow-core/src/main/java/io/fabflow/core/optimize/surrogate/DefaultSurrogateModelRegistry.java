package io.fabflow.core.optimize.surrogate;

import io.fabflow.core.optimize.SurrogateModel;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/// Thread-safe in-memory {@link SurrogateModelRegistry}.
///
/// @implNote Backed by a `ConcurrentHashMap`. Registration and lookup are safe from any
/// thread; the registered models themselves carry their own thread-safety guarantees.
public final class DefaultSurrogateModelRegistry implements SurrogateModelRegistry {

    private final Map<String, SurrogateModel> models = new ConcurrentHashMap<>();

    @Override
    public void register(String reference, SurrogateModel model) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(model, "model must not be null");
        models.put(reference, model);
    }

    @Override
    public Optional<SurrogateModel> get(String reference) {
        Objects.requireNonNull(reference, "reference must not be null");
        return Optional.ofNullable(models.get(reference));
    }

    @Override
    public Set<String> references() {
        return Set.copyOf(models.keySet());
    }
}
