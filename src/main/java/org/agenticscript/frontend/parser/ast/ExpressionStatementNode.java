package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

/**
 * An expression evaluated for its side effects, e.g. {@code a.tell("go")}.
 */
public record ExpressionStatementNode(AstNode expression, SourceInfo sourceInfo) implements AstNode {
}
