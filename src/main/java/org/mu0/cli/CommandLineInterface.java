package org.mu0.cli;

import com.typesafe.config.Config;
import org.mu0.cli.commands.AssembleCommand;
import org.mu0.cli.commands.RunCommand;
import org.mu0.cli.config.ConfigLoader;
import org.mu0.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "mu0",
    mixinStandardHelpOptions = true,
    version = "mu0 1.0",
    description = "Assembler and emulator for the MU0 12-bit accumulator machine",
    subcommands = {
        RunCommand.class,
        AssembleCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    /** Exit code for configuration and I/O failures. */
    public static final int EXIT_FAILURE = 1;

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand given.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine(CommandLine.defaultFactory()).execute(args));
    }

    /**
     * Builds the command tree with the error handling used in production.
     *
     * @param factory Instantiates subcommands; tests pass one that injects collaborators.
     * @return The configured command line.
     */
    public static CommandLine createCommandLine(final CommandLine.IFactory factory) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface(), factory);
        commandLine.setCommandName("mu0");
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            LOG.error("Command '{}' failed", cmd.getCommandName(), ex);
            cmd.getErr().println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        });
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
