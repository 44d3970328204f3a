package org.minilisp.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.minilisp.Interpreter;
import org.minilisp.cli.commands.EvalCommand;
import org.minilisp.cli.commands.ReplCommand;
import org.minilisp.cli.commands.RunCommand;
import org.minilisp.cli.config.ConfigLoader;
import org.minilisp.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "minilisp",
    mixinStandardHelpOptions = true,
    version = "minilisp 1.0",
    description = "A small interpreter for a Lisp-like expression language. Starts the REPL when no command is given.",
    subcommands = {
        ReplCommand.class,
        EvalCommand.class,
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() throws Exception {
        // No subcommand: behave like 'repl'.
        final ReplCommand repl = new ReplCommand();
        repl.setParent(this);
        return repl.call();
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("minilisp");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     * @return The resolved configuration.
     * @throws CommandLine.ParameterException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (ConfigException | IllegalArgumentException e) {
                throw invalidConfiguration(e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * @return A fresh interpreter configured from {@link #getConfig()}.
     * @throws CommandLine.ParameterException if the evaluator settings are invalid.
     */
    public Interpreter createInterpreter() {
        final Config loaded = getConfig();
        try {
            return Interpreter.fromConfig(loaded);
        } catch (ConfigException | IllegalArgumentException e) {
            throw invalidConfiguration(e);
        }
    }

    private CommandLine.ParameterException invalidConfiguration(final Exception e) {
        LOGGER.error("Failed to load or parse configuration: {}", e.getMessage());
        return new CommandLine.ParameterException(spec.commandLine(), "Invalid configuration: " + e.getMessage(), e);
    }
}
