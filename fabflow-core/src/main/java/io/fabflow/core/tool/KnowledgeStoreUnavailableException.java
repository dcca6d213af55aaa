package io.fabflow.core.tool;

import java.io.Serial;

/// Thrown when the knowledge store cannot answer a query.
///
/// Signals a connectivity problem ("retry later"), never a constraint-satisfaction negative;
/// an empty answer is reported by {@link NoCompatibleToolException} instead.
public class KnowledgeStoreUnavailableException extends Exception {

    @Serial private static final long serialVersionUID = 3086517214772402958L;

    public KnowledgeStoreUnavailableException(String message) {
        super(message);
    }

    public KnowledgeStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
