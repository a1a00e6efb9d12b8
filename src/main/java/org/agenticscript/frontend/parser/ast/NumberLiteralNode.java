package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

/**
 * An AST node that represents a numeric literal.
 *
 * @param value The numeric value.
 * @param sourceInfo The position of the literal.
 */
public record NumberLiteralNode(double value, SourceInfo sourceInfo) implements AstNode {
}
