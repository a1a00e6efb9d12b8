package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

import java.util.List;

/**
 * An AST node for {@code { "key": value, other: value }}. Keys are kept in source order.
 */
public record MapLiteralNode(List<MapEntryNode> entries, SourceInfo sourceInfo) implements AstNode {

    public MapLiteralNode {
        entries = List.copyOf(entries);
    }
}
