package org.agenticscript.frontend.api;

import org.agenticscript.frontend.diagnostics.DiagnosticsEngine;
import org.agenticscript.frontend.lexer.Lexer;
import org.agenticscript.frontend.lexer.Token;
import org.agenticscript.frontend.parser.ParseNode;
import org.agenticscript.frontend.parser.Parser;
import org.agenticscript.frontend.parser.ast.Program;
import org.agenticscript.frontend.transform.AstBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The public entry point of the front end: source text in, typed {@link Program} out.
 * <p>
 * Each call uses a fresh {@link DiagnosticsEngine}, so an instance may be reused and shared.
 */
public class ScriptParser {

    private static final Logger log = LoggerFactory.getLogger(ScriptParser.class);

    private final AstBuilder astBuilder = new AstBuilder();

    /**
     * Parses a script.
     *
     * @param source   The script source.
     * @param fileName The logical file name used in diagnostics and source positions.
     * @return The parsed program.
     * @throws ScriptSyntaxException if the lexer or parser reported any error.
     */
    public Program parse(String source, String fileName) throws ScriptSyntaxException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics, fileName).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new ScriptSyntaxException(diagnostics.getDiagnostics());
        }

        ParseNode tree = new Parser(tokens, diagnostics).parse();
        if (diagnostics.hasErrors()) {
            throw new ScriptSyntaxException(diagnostics.getDiagnostics());
        }

        Program program = astBuilder.build(tree, fileName);
        log.debug("Parsed {}: {} top-level statements", fileName, program.statements().size());
        return program;
    }
}
