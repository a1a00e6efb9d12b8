package org.agenticscript.frontend.parser;

import org.agenticscript.frontend.lexer.Token;

import java.util.List;

/**
 * A node of the concrete parse tree produced by the {@link Parser}. The tree is generic:
 * each node only records the grammar {@link Rule} that produced it, its significant token
 * and its children. Typed meaning is assigned later by the AST builder.
 *
 * @param rule The grammar rule that produced this node.
 * @param token The significant token of the node (may be null, see {@link Rule}).
 * @param children The child nodes in source order.
 */
public record ParseNode(Rule rule, Token token, List<ParseNode> children) {

    /**
     * Compact constructor to ensure the child list is never null and immutable.
     */
    public ParseNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    /**
     * Creates a leaf node.
     * @param rule The rule of the leaf.
     * @param token The token of the leaf.
     * @return A node without children.
     */
    public static ParseNode leaf(Rule rule, Token token) {
        return new ParseNode(rule, token, List.of());
    }

    /**
     * Returns the child at the given index.
     * @param index The child index.
     * @return The child node.
     */
    public ParseNode child(int index) {
        return children.get(index);
    }

    /**
     * Returns the text of this node's token.
     * @return The token text, or null if the node has no token.
     */
    public String text() {
        return token == null ? null : token.text();
    }
}
