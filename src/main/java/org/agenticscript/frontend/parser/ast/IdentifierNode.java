package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

/**
 * An AST node that represents a variable reference.
 *
 * @param name The variable name.
 * @param sourceInfo The position of the identifier.
 */
public record IdentifierNode(String name, SourceInfo sourceInfo) implements AstNode {
}
