package org.agenticscript.frontend.api;

import org.agenticscript.frontend.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An exception that is thrown when a script contains one or more syntax errors.
 * <p>
 * It is part of the public API and carries every diagnostic collected while lexing and parsing.
 */
public class ScriptSyntaxException extends Exception {

    private final transient List<Diagnostic> diagnostics;

    /**
     * Constructs a new syntax exception from the collected diagnostics.
     * @param diagnostics The diagnostics, at least one of which is an error.
     */
    public ScriptSyntaxException(List<Diagnostic> diagnostics) {
        super(diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n")));
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics reported for the script.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
