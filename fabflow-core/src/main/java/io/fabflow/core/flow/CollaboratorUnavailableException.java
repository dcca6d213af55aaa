package io.fabflow.core.flow;

import java.io.Serial;

/// Fatal collaborator outage aborting a planning cycle.
///
/// Unlike {@link FlowPlanningException} the input is fine; planning may be retried once the
/// collaborator is back.
public class CollaboratorUnavailableException extends Exception {

    @Serial private static final long serialVersionUID = 1825067230965843541L;

    /// The external collaborator that could not be reached.
    public enum Collaborator {
        KNOWLEDGE_STORE,
        MASK_SERVICE
    }

    private final Collaborator collaborator;
    private final int orderIndex;

    public CollaboratorUnavailableException(
            Collaborator collaborator, int orderIndex, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
        this.orderIndex = orderIndex;
    }

    public Collaborator getCollaborator() {
        return collaborator;
    }

    public int getOrderIndex() {
        return orderIndex;
    }
}
