package org.agenticscript.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.agenticscript.cli.CommandLineInterface;
import org.agenticscript.cli.debug.DebugInspector;
import org.agenticscript.frontend.api.ScriptParser;
import org.agenticscript.frontend.api.ScriptSyntaxException;
import org.agenticscript.frontend.diagnostics.Diagnostic;
import org.agenticscript.frontend.parser.ast.Program;
import org.agenticscript.runtime.RuntimeContext;
import org.agenticscript.runtime.RuntimeOptions;
import org.agenticscript.runtime.api.ExecutionResult;
import org.agenticscript.runtime.interpreter.Interpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Parses and executes an AgenticScript file."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(index = "0", description = "The script file to execute.")
    private File file;

    @Option(names = "--stats", description = "Print agent, bus and tool statistics as JSON after the run.")
    private boolean stats;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error reading file: " + file.getPath());
            log.debug("Could not read {}", file, e);
            return 2;
        }

        RuntimeOptions options;
        try {
            options = RuntimeOptions.fromConfig(parent.getConfig());
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return 2;
        }

        Program program;
        try {
            program = new ScriptParser().parse(source, file.getName());
        } catch (ScriptSyntaxException e) {
            for (Diagnostic diagnostic : e.getDiagnostics()) {
                err.println(diagnostic);
            }
            return 1;
        }

        try (RuntimeContext context = new RuntimeContext(options, line -> {
            out.println(line);
            out.flush();
        })) {
            ExecutionResult result = new Interpreter(context).execute(program);
            if (stats) {
                ObjectMapper mapper = new ObjectMapper();
                out.println(mapper.writerWithDefaultPrettyPrinter()
                        .writeValueAsString(new DebugInspector(context).statistics(mapper)));
            }
            if (!result.isSuccess()) {
                err.println("Error " + result.error().orElseThrow());
                return 1;
            }
            return 0;
        } catch (IOException e) {
            err.println("Failed to write statistics: " + e.getMessage());
            return 1;
        } finally {
            out.flush();
            err.flush();
        }
    }
}
