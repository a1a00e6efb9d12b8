package org.agenticscript.frontend.transform;

import org.agenticscript.frontend.api.SourceInfo;
import org.agenticscript.frontend.lexer.Token;
import org.agenticscript.frontend.parser.ParseNode;
import org.agenticscript.frontend.parser.Rule;
import org.agenticscript.frontend.parser.ast.AstNode;
import org.agenticscript.frontend.parser.ast.Program;

import java.util.List;

/**
 * Transforms the generic parse tree into the typed AST.
 * <p>
 * The transformation is a pure function of its input: it performs no name resolution and keeps
 * no state between calls, so one builder may be shared.
 */
public class AstBuilder {

    private final ConverterRegistry registry;

    public AstBuilder() {
        this(ConverterRegistry.initializeWithDefaults());
    }

    /**
     * @param registry The converters to dispatch parse nodes to.
     */
    public AstBuilder(ConverterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Builds the program from a {@link Rule#PROGRAM} node.
     *
     * @param programNode The root of the parse tree.
     * @param fileName    The logical file name recorded on the program.
     * @return The typed program.
     */
    public Program build(ParseNode programNode, String fileName) {
        if (programNode.rule() != Rule.PROGRAM) {
            throw new IllegalArgumentException("Expected a PROGRAM node but got " + programNode.rule());
        }
        return new Program(fileName, convertAll(programNode.children()));
    }

    /**
     * Converts a single parse node.
     *
     * @param node The node to convert.
     * @return The typed AST node.
     */
    public AstNode convert(ParseNode node) {
        return registry.resolve(node).convert(node, this);
    }

    /**
     * Converts every node of the list, keeping the order.
     *
     * @param nodes The nodes to convert.
     * @return The converted nodes.
     */
    public List<AstNode> convertAll(List<ParseNode> nodes) {
        return nodes.stream().map(this::convert).toList();
    }

    /**
     * Derives the source position of a token.
     *
     * @param token The token.
     * @return Its position.
     */
    public SourceInfo sourceInfo(Token token) {
        return new SourceInfo(token.fileName(), token.line(), token.column());
    }
}
