package org.structura.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.structura.cli.commands.RunCommand;
import org.structura.cli.commands.ValidateCommand;
import org.structura.cli.config.ConfigLoader;
import org.structura.cli.config.LoggingConfigurator;
import org.structura.runtime.EngineOptions;
import org.structura.runtime.api.ConfigurationException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "structura",
    mixinStandardHelpOptions = true,
    version = "Structura 1.0",
    description = "Structura - step-by-step data structure execution with invariant checking",
    subcommands = {
        RunCommand.class,
        ValidateCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /**
     * Every plan step committed.
     */
    public static final int EXIT_OK = 0;
    /**
     * A step was rejected by the invariant validator.
     */
    public static final int EXIT_REJECTED = 1;
    /**
     * Malformed plan, bad configuration or unreadable file.
     */
    public static final int EXIT_INVALID_INPUT = 2;

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * @return a picocli command line for this application.
     */
    public static CommandLine newCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("structura");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging block.
     *
     * @return The resolved configuration.
     * @throws ConfigurationException if the configuration cannot be loaded.
     */
    public Config getConfig() throws ConfigurationException {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (ConfigException | IllegalArgumentException e) {
                throw new ConfigurationException("Failed to load configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * @return the engine options from the {@code structura.engine} block.
     * @throws ConfigurationException if the configuration is missing or holds invalid values.
     */
    public EngineOptions getEngineOptions() throws ConfigurationException {
        try {
            return EngineOptions.fromConfig(getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ConfigurationException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }
}
