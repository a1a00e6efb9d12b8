package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

/**
 * An AST node for {@code *agent->property = value} and {@code *agent->property += value}.
 *
 * @param agentName The name of the variable holding the target agent.
 * @param property The property name.
 * @param mode Whether the value replaces or is appended to the current one.
 * @param value The value expression.
 * @param sourceInfo The position of the assignment operator.
 */
public record PropertyAssignmentNode(
        String agentName,
        String property,
        AssignmentMode mode,
        AstNode value,
        SourceInfo sourceInfo
) implements AstNode {
}
