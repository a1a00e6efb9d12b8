package org.agenticscript.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.agenticscript.cli.commands.ReplCommand;
import org.agenticscript.cli.commands.RunCommand;
import org.agenticscript.cli.config.ConfigLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "agenticscript",
    mixinStandardHelpOptions = true,
    version = "AgenticScript 1.0",
    description = "AgenticScript - a small language for scripting cooperating agents",
    subcommands = {
        RunCommand.class,
        ReplCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("agenticscript");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if the configured file is missing or invalid.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (ConfigException e) {
                throw new IllegalArgumentException("Failed to load or parse configuration: " + e.getMessage(), e);
            }
        }
        return config;
    }
}
