package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

public record MapEntryNode(String key, AstNode value, SourceInfo sourceInfo) implements AstNode {
}
