package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

import java.util.List;

/**
 * An AST node for {@code import a.b.c { X, Y }}.
 *
 * @param modulePath The dotted module path, one element per segment.
 * @param names The imported names in source order.
 * @param sourceInfo The position of the 'import' keyword.
 */
public record ImportStatementNode(List<String> modulePath, List<String> names, SourceInfo sourceInfo) implements AstNode {

    public ImportStatementNode {
        modulePath = List.copyOf(modulePath);
        names = List.copyOf(names);
    }

    /**
     * @return The module path joined with dots.
     */
    public String moduleName() {
        return String.join(".", modulePath);
    }
}
