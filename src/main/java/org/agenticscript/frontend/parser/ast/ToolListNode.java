package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

import java.util.List;

/**
 * An AST node for a tool assignment literal such as {@code { WebSearch, AgentRouting{ b, c } }}.
 */
public record ToolListNode(List<ToolSpecNode> tools, SourceInfo sourceInfo) implements AstNode {

    public ToolListNode {
        tools = List.copyOf(tools);
    }
}
