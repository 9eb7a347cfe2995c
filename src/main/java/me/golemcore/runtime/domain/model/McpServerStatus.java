package me.golemcore.runtime.domain.model;

/**
 * Connection state of a configured MCP server, for display.
 */
public enum McpServerStatus {
    DISCONNECTED, CONNECTING, CONNECTED, FAILED
}
