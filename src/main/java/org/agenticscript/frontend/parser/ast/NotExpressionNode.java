package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

public record NotExpressionNode(AstNode operand, SourceInfo sourceInfo) implements AstNode {
}
