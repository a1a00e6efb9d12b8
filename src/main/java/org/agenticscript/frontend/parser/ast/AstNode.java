package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * The set of node variants is closed, so the interpreter can dispatch over it exhaustively.
 */
public sealed interface AstNode permits
        ImportStatementNode, AgentDeclarationNode, ConfigEntryNode, PropertyAssignmentNode,
        AssignmentNode, PrintStatementNode, ExpressionStatementNode, IfStatementNode,
        LogicalExpressionNode, NotExpressionNode, ComparisonNode, MethodCallNode,
        PropertyAccessNode, IdentifierNode, StringLiteralNode, NumberLiteralNode,
        BooleanLiteralNode, NullLiteralNode, ListLiteralNode, MapLiteralNode, MapEntryNode,
        ToolListNode, ToolSpecNode, InterpolatedStringNode {

    /**
     * Returns the position of the construct in the source.
     * @return The source position.
     */
    SourceInfo sourceInfo();
}
