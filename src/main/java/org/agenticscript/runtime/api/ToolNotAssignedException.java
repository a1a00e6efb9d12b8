package org.agenticscript.runtime.api;

/**
 * Raised when an agent invokes a tool that is registered but not assigned to it.
 */
public class ToolNotAssignedException extends ScriptError {

    public ToolNotAssignedException(String agentName, String tool) {
        super(ErrorCode.TOOL_NOT_ASSIGNED, "Agent " + agentName + " does not have tool: " + tool);
    }
}
