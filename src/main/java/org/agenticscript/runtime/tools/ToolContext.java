package org.agenticscript.runtime.tools;

import org.agenticscript.runtime.bus.MessageBus;

import java.util.List;

/**
 * What a tool handler knows about the call it serves.
 *
 * @param callerAgentId The id of the agent invoking the tool.
 * @param boundAgentIds The routing targets of the caller's binding; empty for ordinary tools.
 * @param bus The message bus, for tools that communicate with other agents.
 */
public record ToolContext(String callerAgentId, List<String> boundAgentIds, MessageBus bus) {

    public ToolContext {
        boundAgentIds = List.copyOf(boundAgentIds);
    }
}
