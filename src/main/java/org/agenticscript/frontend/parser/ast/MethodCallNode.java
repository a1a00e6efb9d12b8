package org.agenticscript.frontend.parser.ast;

import org.agenticscript.frontend.api.SourceInfo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An AST node for {@code receiver.method(args)}.
 *
 * @param receiver The expression the method is called on.
 * @param method The method name.
 * @param arguments The positional arguments in source order.
 * @param namedArguments The named arguments ({@code timeout=5}) in source order.
 * @param sourceInfo The position of the method name.
 */
public record MethodCallNode(
        AstNode receiver,
        String method,
        List<AstNode> arguments,
        Map<String, AstNode> namedArguments,
        SourceInfo sourceInfo
) implements AstNode {

    public MethodCallNode {
        arguments = List.copyOf(arguments);
        namedArguments = Collections.unmodifiableMap(new LinkedHashMap<>(namedArguments));
    }
}
