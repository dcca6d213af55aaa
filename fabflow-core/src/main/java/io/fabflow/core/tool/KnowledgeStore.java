package io.fabflow.core.tool;

import java.util.List;

/// Narrow query interface onto the fab knowledge base.
///
/// The planning core depends only on this capability, "resolve candidate tools for
/// constraints", and never on a particular graph database or query language. Stores may
/// pre-filter on any of the query's constraints; the {@link ToolSelector} re-applies the full
/// eligibility check regardless.
///
/// ### Contracts
/// - **Postcondition**: idempotent and side-effect free from the engine's perspective
/// - **Postcondition**: result order is arbitrary
///
/// @see InMemoryKnowledgeStore for the in-memory implementation
/// @see DeadlineKnowledgeStore for bounding query latency
public interface KnowledgeStore {

    /// Returns tools that may satisfy the query.
    ///
    /// @param query category, wafer size and materials of the step, not null
    /// @return candidate tools, never null (may be empty)
    /// @throws KnowledgeStoreUnavailableException if the store cannot be reached
    List<ToolRecord> findCandidateTools(ToolQuery query) throws KnowledgeStoreUnavailableException;
}
