package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

/**
 * An AST node that represents a string literal.
 *
 * @param value The unescaped content of the literal.
 * @param sourceInfo The position of the opening quote.
 */
public record StringLiteralNode(String value, SourceInfo sourceInfo) implements AstNode {
}
