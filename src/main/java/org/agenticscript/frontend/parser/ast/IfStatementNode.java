package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

import java.util.List;

/**
 * An AST node for {@code if cond { ... } else { ... }}. An {@code else if} is represented as an
 * else-block holding a single nested {@link IfStatementNode}.
 *
 * @param condition The condition, which must evaluate to a boolean.
 * @param thenBlock The statements run when the condition holds.
 * @param elseBlock The statements run otherwise, or null if there is no else branch.
 * @param sourceInfo The position of the 'if' keyword.
 */
public record IfStatementNode(
        AstNode condition,
        List<AstNode> thenBlock,
        List<AstNode> elseBlock,
        SourceInfo sourceInfo
) implements AstNode {

    public IfStatementNode {
        thenBlock = List.copyOf(thenBlock);
        elseBlock = elseBlock == null ? null : List.copyOf(elseBlock);
    }
}
