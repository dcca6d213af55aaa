package io.fabflow.core.tool;

/// Operational status of a manufacturing tool.
public enum ToolStatus {
    AVAILABLE,
    DOWN,
    MAINTENANCE
}
