package org.agenticscript.cli.commands;

import com.typesafe.config.Config;
import org.agenticscript.cli.CommandLineInterface;
import org.agenticscript.cli.debug.ReplSession;
import org.agenticscript.runtime.RuntimeContext;
import org.agenticscript.runtime.RuntimeOptions;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.ParsedLine;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "repl",
    mixinStandardHelpOptions = true,
    description = "Starts an interactive AgenticScript session."
)
public class ReplCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplCommand.class);

    static final List<String> TOP_LEVEL_WORDS = List.of("debug", "exit", "quit");
    static final List<String> DEBUG_WORDS = List.of("agents", "dump", "system", "messages", "flows", "tools", "history", "clear", "help");

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config;
        RuntimeOptions options;
        try {
            config = parent.getConfig();
            options = RuntimeOptions.fromConfig(config);
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 2;
        }
        String prompt = config.getString("agenticscript.repl.prompt");

        try (Terminal terminal = openTerminal()) {
            PrintWriter writer = terminal.writer();
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .completer(new ReplCompleter())
                    .history(new DefaultHistory())
                    .build();
            try (RuntimeContext context = new RuntimeContext(options, line -> {
                writer.println(line);
                writer.flush();
            })) {
                ReplSession session = new ReplSession(context, line -> {
                    writer.println(line);
                    writer.flush();
                });
                writer.println("AgenticScript REPL. Type 'debug help' for inspection commands, 'exit' to leave.");
                writer.flush();
                while (true) {
                    try {
                        String line = lineReader.readLine(prompt);
                        if (!session.handle(line)) {
                            return 0;
                        }
                    } catch (UserInterruptException e) {
                        // Ctrl-C discards the current line
                    } catch (EndOfFileException e) {
                        return 0;
                    }
                }
            }
        } catch (IOException e) {
            log.error("Failed to open terminal: {}", e.getMessage());
            return 1;
        }
    }

    private Terminal openTerminal() throws IOException {
        try {
            return TerminalBuilder.builder().system(true).build();
        } catch (IOException | IllegalStateException e) {
            log.debug("System terminal unavailable, falling back to a dumb terminal", e);
            return TerminalBuilder.builder().dumb(true).build();
        }
    }

    /**
     * Completes REPL commands and the debug subcommands.
     */
    static class ReplCompleter implements Completer {

        @Override
        public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
            String word = line.word();
            if (line.wordIndex() == 0) {
                addMatching(TOP_LEVEL_WORDS, word, candidates);
            } else if (line.wordIndex() == 1 && "debug".equals(line.words().get(0))) {
                addMatching(DEBUG_WORDS, word, candidates);
            }
        }

        private void addMatching(List<String> words, String prefix, List<Candidate> candidates) {
            for (String candidate : words) {
                if (candidate.startsWith(prefix)) {
                    candidates.add(new Candidate(candidate));
                }
            }
        }
    }
}
