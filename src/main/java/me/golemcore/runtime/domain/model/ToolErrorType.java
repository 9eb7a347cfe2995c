package me.golemcore.runtime.domain.model;

/**
 * Machine-readable classification of tool call failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolErrorType {

    /**
     * The requested tool name is not present in the registry.
     */
    UNKNOWN_TOOL,

    /**
     * Arguments did not pass schema or tool-specific validation.
     */
    INVALID_TOOL_PARAMS,

    /**
     * Execution was denied by the policy engine or a BeforeTool hook.
     */
    POLICY_DENIED,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, non-zero exit,
     * AfterTool veto, etc.).
     */
    EXECUTION_FAILED,

    /**
     * A hook asked to halt the turn.
     */
    STOP_EXECUTION,

    /**
     * Transport or protocol failure talking to an MCP server.
     */
    MCP_TOOL_ERROR,

    /**
     * The call was cancelled, either by the batch signal or by the user at the
     * confirmation prompt.
     */
    ABORTED
}
