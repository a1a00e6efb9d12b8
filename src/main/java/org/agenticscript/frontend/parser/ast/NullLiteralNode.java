package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

public record NullLiteralNode(SourceInfo sourceInfo) implements AstNode {
}
