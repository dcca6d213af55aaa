package io.fabflow.core.tool;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory {@link KnowledgeStore} backed by a tool catalog.
///
/// Pre-filters candidates on category and wafer size, like a graph query matching tool to
/// process would; status and material compatibility are left to the selector.
///
/// ### Usage
/// {@snippet :
/// InMemoryKnowledgeStore store = new InMemoryKnowledgeStore();
/// store.register(cvd01);
/// store.register(etch02);
/// }
///
/// @implNote Thread-safe. Uses a `ConcurrentHashMap` keyed by tool id.
public final class InMemoryKnowledgeStore implements KnowledgeStore {

    private final Map<String, ToolRecord> tools = new ConcurrentHashMap<>();

    public InMemoryKnowledgeStore() {}

    /// Creates a store with an initial catalog.
    ///
    /// @param initialTools tools to register, not null
    public InMemoryKnowledgeStore(List<ToolRecord> initialTools) {
        Objects.requireNonNull(initialTools, "initialTools must not be null");
        initialTools.forEach(this::register);
    }

    /// Registers a tool, replacing any tool with the same id.
    ///
    /// @param tool the tool, not null
    public void register(ToolRecord tool) {
        Objects.requireNonNull(tool, "tool must not be null");
        tools.put(tool.toolId(), tool);
    }

    public Optional<ToolRecord> get(String toolId) {
        Objects.requireNonNull(toolId, "toolId must not be null");
        return Optional.ofNullable(tools.get(toolId));
    }

    public boolean remove(String toolId) {
        Objects.requireNonNull(toolId, "toolId must not be null");
        return tools.remove(toolId) != null;
    }

    /// Returns every registered tool ordered by id.
    ///
    /// @return immutable list, never null
    public List<ToolRecord> all() {
        return tools.values().stream().sorted(Comparator.comparing(ToolRecord::toolId)).toList();
    }

    public int size() {
        return tools.size();
    }

    @Override
    public List<ToolRecord> findCandidateTools(ToolQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return tools.values().stream()
                .filter(tool -> tool.capableCategories().contains(query.category()))
                .filter(tool -> tool.waferSize() == query.waferSize())
                .toList();
    }
}
