package io.fabflow.core.flow;

import java.io.Serial;

/// Fatal input violation aborting a planning cycle.
///
/// No partial flow is produced. The caller has to fix the input before planning again.
public class FlowPlanningException extends Exception {

    @Serial private static final long serialVersionUID = -7719826425101953617L;

    /// Why planning was aborted.
    public enum FailureReason {
        /// A change descriptor violates its required-attribute contract.
        MALFORMED_DESCRIPTOR,
        /// A lithography step has no layout reference to cut its mask from.
        MISSING_LAYOUT_REFERENCE,
        /// The selected tool lacks the surrogate model needed to optimize its recipe.
        INCOMPLETE_TOOL_RECORD
    }

    private final FailureReason reason;
    private final int orderIndex;

    public FlowPlanningException(FailureReason reason, int orderIndex, String message) {
        super(message);
        this.reason = reason;
        this.orderIndex = orderIndex;
    }

    public FailureReason getReason() {
        return reason;
    }

    /// Returns the order index of the offending change.
    ///
    /// @return order index as supplied on input, may be negative for malformed input
    public int getOrderIndex() {
        return orderIndex;
    }
}
