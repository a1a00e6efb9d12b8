package org.agenticscript.cli.debug;

import org.agenticscript.frontend.api.ScriptParser;
import org.agenticscript.frontend.api.ScriptSyntaxException;
import org.agenticscript.frontend.diagnostics.Diagnostic;
import org.agenticscript.frontend.parser.ast.AstNode;
import org.agenticscript.frontend.parser.ast.Program;
import org.agenticscript.runtime.RuntimeContext;
import org.agenticscript.runtime.api.ScriptExecutionException;
import org.agenticscript.runtime.interpreter.Interpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * The terminal-independent part of the REPL. Every input line is either a REPL command
 * ({@code exit}, {@code quit}, {@code debug ...}) or a program fragment whose statements run
 * against one long-lived {@link Interpreter}, so names survive between lines.
 */
public class ReplSession {

    private static final Logger log = LoggerFactory.getLogger(ReplSession.class);
    static final String SOURCE_NAME = "<repl>";

    private final ScriptParser parser = new ScriptParser();
    private final RuntimeContext context;
    private final Interpreter interpreter;
    private final DebugInspector inspector;
    private final Consumer<String> out;
    private final List<String> history = new ArrayList<>();
    private int lineNumber;

    /**
     * @param context The runtime the session executes against. Script output should go to {@code out} as well.
     * @param out Receives every line the session prints.
     */
    public ReplSession(RuntimeContext context, Consumer<String> out) {
        this.context = context;
        this.interpreter = new Interpreter(context);
        this.inspector = new DebugInspector(context);
        this.out = out;
    }

    /**
     * Handles one input line.
     *
     * @param line The raw input.
     * @return false if the session should end.
     */
    public boolean handle(String line) {
        String input = line == null ? "" : line.trim();
        if (input.isEmpty()) {
            return true;
        }
        if (input.equals("exit") || input.equals("quit")) {
            return false;
        }
        if (input.equals("debug") || input.startsWith("debug ")) {
            debug(input.substring("debug".length()).trim());
            return true;
        }
        evaluate(line);
        return true;
    }

    private void evaluate(String source) {
        lineNumber++;
        history.add(source.trim());
        Program program;
        try {
            program = parser.parse(source, SOURCE_NAME + ":" + lineNumber);
        } catch (ScriptSyntaxException e) {
            for (Diagnostic diagnostic : e.getDiagnostics()) {
                out.accept(diagnostic.toString());
            }
            return;
        }
        for (AstNode statement : program.statements()) {
            try {
                interpreter.executeStatement(statement);
            } catch (ScriptExecutionException e) {
                log.debug("REPL statement failed", e);
                out.accept("Error " + e.getError());
                return;
            }
        }
    }

    private void debug(String arguments) {
        String[] parts = arguments.isEmpty() ? new String[0] : arguments.split("\\s+");
        String command = parts.length == 0 ? "help" : parts[0];
        switch (command) {
            case "agents" -> inspector.agents().forEach(out);
            case "dump" -> {
                if (parts.length < 2) {
                    out.accept("Usage: debug dump <agent>");
                } else {
                    inspector.dump(parts[1]).forEach(out);
                }
            }
            case "system" -> inspector.system().forEach(out);
            case "messages" -> inspector.messages(messageLimit(parts)).forEach(out);
            case "history" -> history(messageLimit(parts));
            case "clear" -> {
                context.getBus().clearHistory();
                out.accept("Message history cleared.");
            }
            case "flows" -> inspector.flows().forEach(out);
            case "tools" -> inspector.tools().forEach(out);
            case "help" -> inspector.help().forEach(out);
            default -> {
                out.accept("Unknown debug command: " + command);
                inspector.help().forEach(out);
            }
        }
    }

    private void history(int limit) {
        if (history.isEmpty()) {
            out.accept("No input yet.");
            return;
        }
        for (int i = Math.max(0, history.size() - limit); i < history.size(); i++) {
            out.accept(String.format("%4d  %s", i + 1, history.get(i)));
        }
    }

    private int messageLimit(String[] parts) {
        if (parts.length < 2) {
            return DebugInspector.DEFAULT_MESSAGE_LIMIT;
        }
        try {
            return Math.max(1, Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            out.accept("Not a number: " + parts[1] + ", showing " + DebugInspector.DEFAULT_MESSAGE_LIMIT);
            return DebugInspector.DEFAULT_MESSAGE_LIMIT;
        }
    }

    /**
     * @return The program lines entered so far, oldest first. REPL commands are not included.
     */
    public List<String> getHistory() {
        return List.copyOf(history);
    }

    public Interpreter getInterpreter() {
        return interpreter;
    }
}
