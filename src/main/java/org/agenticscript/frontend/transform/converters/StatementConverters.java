package org.agenticscript.frontend.transform.converters;

import org.agenticscript.frontend.lexer.TokenType;
import org.agenticscript.frontend.parser.ParseNode;
import org.agenticscript.frontend.parser.Rule;
import org.agenticscript.frontend.parser.ast.AgentDeclarationNode;
import org.agenticscript.frontend.parser.ast.AssignmentMode;
import org.agenticscript.frontend.parser.ast.AssignmentNode;
import org.agenticscript.frontend.parser.ast.AstNode;
import org.agenticscript.frontend.parser.ast.ConfigEntryNode;
import org.agenticscript.frontend.parser.ast.ExpressionStatementNode;
import org.agenticscript.frontend.parser.ast.IfStatementNode;
import org.agenticscript.frontend.parser.ast.ImportStatementNode;
import org.agenticscript.frontend.parser.ast.PrintStatementNode;
import org.agenticscript.frontend.parser.ast.PropertyAssignmentNode;
import org.agenticscript.frontend.transform.AstBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Converters for statement rules.
 */
public final class StatementConverters {

    private StatementConverters() {
    }

    public static AstNode importStatement(ParseNode node, AstBuilder builder) {
        return new ImportStatementNode(
                texts(node.child(0).children()),
                texts(node.child(1).children()),
                builder.sourceInfo(node.token()));
    }

    public static AstNode agentDeclaration(ParseNode node, AstBuilder builder) {
        List<ConfigEntryNode> config = new ArrayList<>();
        for (ParseNode entry : node.children().subList(2, node.children().size())) {
            config.add((ConfigEntryNode) builder.convert(entry));
        }
        return new AgentDeclarationNode(
                node.text(),
                node.child(0).text(),
                node.child(1).text(),
                config,
                builder.sourceInfo(node.token()));
    }

    public static AstNode configEntry(ParseNode node, AstBuilder builder) {
        return new ConfigEntryNode(node.text(), builder.convert(node.child(0)), builder.sourceInfo(node.token()));
    }

    public static AstNode propertyAssignment(ParseNode node, AstBuilder builder) {
        AssignmentMode mode = node.token().type() == TokenType.PLUS_EQUAL ? AssignmentMode.APPEND : AssignmentMode.SET;
        return new PropertyAssignmentNode(
                node.child(0).text(),
                node.child(1).text(),
                mode,
                builder.convert(node.child(2)),
                builder.sourceInfo(node.child(0).token()));
    }

    public static AstNode assignment(ParseNode node, AstBuilder builder) {
        return new AssignmentNode(
                node.text(),
                builder.convert(node.child(0)),
                node.rule() == Rule.LET_DECLARATION,
                builder.sourceInfo(node.token()));
    }

    public static AstNode print(ParseNode node, AstBuilder builder) {
        return new PrintStatementNode(builder.convert(node.child(0)), builder.sourceInfo(node.token()));
    }

    public static AstNode expressionStatement(ParseNode node, AstBuilder builder) {
        return new ExpressionStatementNode(builder.convert(node.child(0)), builder.sourceInfo(node.token()));
    }

    public static AstNode ifStatement(ParseNode node, AstBuilder builder) {
        AstNode condition = builder.convert(node.child(0));
        List<AstNode> thenBlock = builder.convertAll(node.child(1).children());
        List<AstNode> elseBlock = null;
        if (node.children().size() > 2) {
            ParseNode elseNode = node.child(2);
            elseBlock = elseNode.rule() == Rule.IF
                    ? List.of(builder.convert(elseNode))
                    : builder.convertAll(elseNode.children());
        }
        return new IfStatementNode(condition, thenBlock, elseBlock, builder.sourceInfo(node.token()));
    }

    private static List<String> texts(List<ParseNode> leaves) {
        return leaves.stream().map(ParseNode::text).toList();
    }
}
