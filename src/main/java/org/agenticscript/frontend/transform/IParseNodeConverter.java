package org.agenticscript.frontend.transform;

import org.agenticscript.frontend.parser.ParseNode;
import org.agenticscript.frontend.parser.ast.AstNode;

/**
 * Converts the parse node of one grammar rule into its typed AST node.
 * <p>
 * Implementations must be stateless. Child nodes are converted by calling back into the
 * provided {@link AstBuilder}.
 */
@FunctionalInterface
public interface IParseNodeConverter {

    /**
     * Converts the given parse node.
     *
     * @param node    The parse node to convert.
     * @param builder The builder used to convert children and to derive source positions.
     * @return The typed AST node.
     */
    AstNode convert(ParseNode node, AstBuilder builder);
}
