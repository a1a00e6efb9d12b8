package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

/**
 * A short-circuiting {@code and} / {@code or} expression.
 */
public record LogicalExpressionNode(
        LogicalOperator operator,
        AstNode left,
        AstNode right,
        SourceInfo sourceInfo
) implements AstNode {
}
