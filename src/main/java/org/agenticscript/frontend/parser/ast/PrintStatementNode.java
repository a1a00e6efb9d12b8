package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

public record PrintStatementNode(AstNode expression, SourceInfo sourceInfo) implements AstNode {
}
