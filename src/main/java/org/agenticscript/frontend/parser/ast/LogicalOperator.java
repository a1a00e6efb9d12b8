package org.agenticscript.frontend.parser.ast;

public enum LogicalOperator {
    AND,
    OR
}
