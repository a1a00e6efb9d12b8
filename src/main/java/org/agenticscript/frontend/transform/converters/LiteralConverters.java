package org.agenticscript.frontend.transform.converters;

import org.agenticscript.frontend.lexer.TokenType;
import org.agenticscript.frontend.parser.ParseNode;
import org.agenticscript.frontend.parser.ast.AstNode;
import org.agenticscript.frontend.parser.ast.BooleanLiteralNode;
import org.agenticscript.frontend.parser.ast.ListLiteralNode;
import org.agenticscript.frontend.parser.ast.MapEntryNode;
import org.agenticscript.frontend.parser.ast.MapLiteralNode;
import org.agenticscript.frontend.parser.ast.NullLiteralNode;
import org.agenticscript.frontend.parser.ast.NumberLiteralNode;
import org.agenticscript.frontend.parser.ast.StringLiteralNode;
import org.agenticscript.frontend.parser.ast.ToolListNode;
import org.agenticscript.frontend.parser.ast.ToolSpecNode;
import org.agenticscript.frontend.transform.AstBuilder;

import java.util.List;

/**
 * Converters for literal rules.
 */
public final class LiteralConverters {

    private LiteralConverters() {
    }

    public static AstNode string(ParseNode node, AstBuilder builder) {
        return new StringLiteralNode((String) node.token().value(), builder.sourceInfo(node.token()));
    }

    public static AstNode number(ParseNode node, AstBuilder builder) {
        return new NumberLiteralNode((Double) node.token().value(), builder.sourceInfo(node.token()));
    }

    public static AstNode bool(ParseNode node, AstBuilder builder) {
        return new BooleanLiteralNode(node.token().type() == TokenType.TRUE, builder.sourceInfo(node.token()));
    }

    public static AstNode nullLiteral(ParseNode node, AstBuilder builder) {
        return new NullLiteralNode(builder.sourceInfo(node.token()));
    }

    public static AstNode list(ParseNode node, AstBuilder builder) {
        return new ListLiteralNode(builder.convertAll(node.children()), builder.sourceInfo(node.token()));
    }

    public static AstNode map(ParseNode node, AstBuilder builder) {
        List<MapEntryNode> entries = node.children().stream()
                .map(entry -> (MapEntryNode) builder.convert(entry))
                .toList();
        return new MapLiteralNode(entries, builder.sourceInfo(node.token()));
    }

    /**
     * String keys use their unescaped content, identifier keys their name.
     */
    public static AstNode mapEntry(ParseNode node, AstBuilder builder) {
        String key = node.token().type() == TokenType.STRING ? (String) node.token().value() : node.text();
        return new MapEntryNode(key, builder.convert(node.child(0)), builder.sourceInfo(node.token()));
    }

    public static AstNode toolList(ParseNode node, AstBuilder builder) {
        List<ToolSpecNode> tools = node.children().stream()
                .map(spec -> (ToolSpecNode) builder.convert(spec))
                .toList();
        return new ToolListNode(tools, builder.sourceInfo(node.token()));
    }

    public static AstNode toolSpec(ParseNode node, AstBuilder builder) {
        List<String> targets = node.children().stream().map(ParseNode::text).toList();
        return new ToolSpecNode(node.text(), targets, builder.sourceInfo(node.token()));
    }
}
