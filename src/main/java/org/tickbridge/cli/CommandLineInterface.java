package org.tickbridge.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.tickbridge.cli.commands.RunCommand;
import org.tickbridge.cli.config.ConfigLoader;
import org.tickbridge.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "tickbridge",
    mixinStandardHelpOptions = true,
    version = "TickBridge 1.0",
    description = "TickBridge - synchronizes background tasks with a tick-driven world",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/tickbridge.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates the command line with the same setup as {@link #main(String[])}, for tests.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("tickbridge");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging levels.
     *
     * @throws CommandLine.ParameterException if the configuration cannot be loaded
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        try {
            config = ConfigLoader.resolve(configFile, (warning, message) -> {
                if (warning) {
                    logger.debug(message);
                } else {
                    logger.info(message);
                }
            });
        } catch (IllegalArgumentException | ConfigException e) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                    "Failed to load configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
        return config;
    }
}
