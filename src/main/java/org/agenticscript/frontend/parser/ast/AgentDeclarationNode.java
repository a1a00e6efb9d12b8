package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

import java.util.List;

/**
 * An AST node for {@code agent name = spawn Kind{ model, key: value, ... }}.
 *
 * @param name The variable name the agent is bound to.
 * @param kind The agent kind, e.g. {@code Agent}.
 * @param model The opaque model descriptor.
 * @param config The constructor configuration entries in source order.
 * @param sourceInfo The position of the agent name.
 */
public record AgentDeclarationNode(
        String name,
        String kind,
        String model,
        List<ConfigEntryNode> config,
        SourceInfo sourceInfo
) implements AstNode {

    public AgentDeclarationNode {
        config = List.copyOf(config);
    }
}
