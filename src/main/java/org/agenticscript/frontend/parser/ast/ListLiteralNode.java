package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

import java.util.List;

public record ListLiteralNode(List<AstNode> elements, SourceInfo sourceInfo) implements AstNode {

    public ListLiteralNode {
        elements = List.copyOf(elements);
    }
}
