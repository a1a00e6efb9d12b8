package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

public record ComparisonNode(
        ComparisonOperator operator,
        AstNode left,
        AstNode right,
        SourceInfo sourceInfo
) implements AstNode {
}
