package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

/**
 * An AST node for variable assignments.
 *
 * @param name The variable name.
 * @param value The value expression.
 * @param declaration {@code true} for {@code let name = value}, which declares in the current scope.
 * @param sourceInfo The position of the variable name.
 */
public record AssignmentNode(String name, AstNode value, boolean declaration, SourceInfo sourceInfo) implements AstNode {
}
