package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

import java.util.List;

/**
 * One entry of a {@link ToolListNode}.
 *
 * @param toolName The registered tool name.
 * @param routedAgents The names of the agents the tool routes to; empty for ordinary tools.
 * @param sourceInfo The position of the tool name.
 */
public record ToolSpecNode(String toolName, List<String> routedAgents, SourceInfo sourceInfo) implements AstNode {

    public ToolSpecNode {
        routedAgents = List.copyOf(routedAgents);
    }
}
