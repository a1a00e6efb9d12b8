package org.agenticscript.frontend.transform.converters;

import org.agenticscript.frontend.lexer.TokenType;
import org.agenticscript.frontend.parser.ParseNode;
import org.agenticscript.frontend.parser.Rule;
import org.agenticscript.frontend.parser.ast.AstNode;
import org.agenticscript.frontend.parser.ast.ComparisonNode;
import org.agenticscript.frontend.parser.ast.ComparisonOperator;
import org.agenticscript.frontend.parser.ast.IdentifierNode;
import org.agenticscript.frontend.parser.ast.InterpolatedStringNode;
import org.agenticscript.frontend.parser.ast.LogicalExpressionNode;
import org.agenticscript.frontend.parser.ast.LogicalOperator;
import org.agenticscript.frontend.parser.ast.MethodCallNode;
import org.agenticscript.frontend.parser.ast.NotExpressionNode;
import org.agenticscript.frontend.parser.ast.PropertyAccessNode;
import org.agenticscript.frontend.transform.AstBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converters for operator, member access and identifier rules.
 */
public final class ExpressionConverters {

    private ExpressionConverters() {
    }

    public static AstNode logical(ParseNode node, AstBuilder builder) {
        LogicalOperator operator = node.token().type() == TokenType.AND ? LogicalOperator.AND : LogicalOperator.OR;
        return new LogicalExpressionNode(operator,
                builder.convert(node.child(0)),
                builder.convert(node.child(1)),
                builder.sourceInfo(node.token()));
    }

    public static AstNode not(ParseNode node, AstBuilder builder) {
        return new NotExpressionNode(builder.convert(node.child(0)), builder.sourceInfo(node.token()));
    }

    public static AstNode comparison(ParseNode node, AstBuilder builder) {
        return new ComparisonNode(ComparisonOperator.fromSymbol(node.text()),
                builder.convert(node.child(0)),
                builder.convert(node.child(1)),
                builder.sourceInfo(node.token()));
    }

    /**
     * Splits the ARGUMENT children into positional and named arguments. A repeated argument
     * name keeps the last value.
     */
    public static AstNode methodCall(ParseNode node, AstBuilder builder) {
        List<AstNode> positional = new ArrayList<>();
        Map<String, AstNode> named = new LinkedHashMap<>();
        for (ParseNode argument : node.children().subList(1, node.children().size())) {
            AstNode value = builder.convert(argument.child(0));
            if (argument.token() == null) {
                positional.add(value);
            } else {
                named.put(argument.text(), value);
            }
        }
        return new MethodCallNode(builder.convert(node.child(0)), node.text(), positional, named,
                builder.sourceInfo(node.token()));
    }

    public static AstNode propertyAccess(ParseNode node, AstBuilder builder) {
        return new PropertyAccessNode(builder.convert(node.child(0)), node.text(), builder.sourceInfo(node.token()));
    }

    public static AstNode identifier(ParseNode node, AstBuilder builder) {
        return new IdentifierNode(node.text(), builder.sourceInfo(node.token()));
    }

    public static AstNode interpolatedString(ParseNode node, AstBuilder builder) {
        List<InterpolatedStringNode.Segment> segments = new ArrayList<>();
        for (ParseNode segment : node.children()) {
            if (segment.rule() == Rule.TEXT_SEGMENT) {
                segments.add(new InterpolatedStringNode.Segment.Text(segment.text()));
            } else {
                segments.add(new InterpolatedStringNode.Segment.Embedded(builder.convert(segment.child(0))));
            }
        }
        return new InterpolatedStringNode(segments, builder.sourceInfo(node.token()));
    }
}
