package io.fabflow.core.tool;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// {@link KnowledgeStore} decorator bounding each query by a deadline.
///
/// The query runs on the supplied executor. If it does not answer within the deadline the
/// future is cancelled and an **empty** candidate list is returned, which the selector
/// reports as {@link NoCompatibleToolException}. Failures of the delegate keep their meaning:
/// {@link KnowledgeStoreUnavailableException} propagates unchanged and any other exception
/// is wrapped in one.
///
/// @implNote The executor is owned by the caller (normally
/// {@link io.fabflow.core.FabflowEnvironment}) and must outlive this decorator.
public final class DeadlineKnowledgeStore implements KnowledgeStore {

    private static final Logger logger = Logger.getLogger(DeadlineKnowledgeStore.class.getName());

    private final KnowledgeStore delegate;
    private final Duration deadline;
    private final ExecutorService executor;

    /// Creates the decorator.
    ///
    /// @param delegate the store to query, not null
    /// @param deadline maximum wait per query, positive, not null
    /// @param executor executor running the queries, not null
    public DeadlineKnowledgeStore(
            KnowledgeStore delegate, Duration deadline, ExecutorService executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.deadline = Objects.requireNonNull(deadline, "deadline must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        if (deadline.isNegative() || deadline.isZero()) {
            throw new IllegalArgumentException("deadline must be positive");
        }
    }

    @Override
    public List<ToolRecord> findCandidateTools(ToolQuery query)
            throws KnowledgeStoreUnavailableException {
        Objects.requireNonNull(query, "query must not be null");
        Future<List<ToolRecord>> future = executor.submit(() -> delegate.findCandidateTools(query));
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warning(
                    "Knowledge store query for " + query.category() + " exceeded deadline of "
                            + deadline.toMillis() + " ms; treating as no candidates");
            return List.of();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof KnowledgeStoreUnavailableException unavailable) {
                throw unavailable;
            }
            throw new KnowledgeStoreUnavailableException(
                    "Knowledge store query failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new KnowledgeStoreUnavailableException("Knowledge store query interrupted", e);
        }
    }

    public Duration getDeadline() {
        return deadline;
    }
}
