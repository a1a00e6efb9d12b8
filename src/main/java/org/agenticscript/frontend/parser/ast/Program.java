package org.agenticscript.frontend.parser.ast;

import java.util.List;

/**
 * The root of a parsed script: its top-level statements in source order.
 *
 * @param fileName The logical name of the parsed file.
 * @param statements The top-level statements.
 */
public record Program(String fileName, List<AstNode> statements) {

    public Program {
        statements = List.copyOf(statements);
    }
}
