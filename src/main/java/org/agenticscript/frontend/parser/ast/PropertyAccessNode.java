package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

public record PropertyAccessNode(AstNode receiver, String property, SourceInfo sourceInfo) implements AstNode {
}
