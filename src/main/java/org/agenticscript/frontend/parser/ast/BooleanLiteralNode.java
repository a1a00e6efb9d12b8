package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

public record BooleanLiteralNode(boolean value, SourceInfo sourceInfo) implements AstNode {
}
