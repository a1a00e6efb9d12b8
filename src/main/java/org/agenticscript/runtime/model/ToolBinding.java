package org.agenticscript.runtime.model;

import java.util.List;

/**
 * The assignment of one tool to an agent.
 *
 * @param toolName The registered tool name.
 * @param targetAgentIds The agents a routing tool forwards to; empty for other tools.
 */
public record ToolBinding(String toolName, List<String> targetAgentIds) {

    public ToolBinding {
        targetAgentIds = List.copyOf(targetAgentIds);
    }

    public static ToolBinding of(String toolName) {
        return new ToolBinding(toolName, List.of());
    }
}
