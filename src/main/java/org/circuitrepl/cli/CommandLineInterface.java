package org.circuitrepl.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.circuitrepl.cli.commands.ReplCommand;
import org.circuitrepl.config.ConfigLoader;
import org.circuitrepl.config.LoggingConfigurator;
import org.circuitrepl.worker.WorkerMain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "circuitrepl",
    mixinStandardHelpOptions = true,
    version = "circuitrepl 1.0",
    description = "Interactive CircuitPython-style REPL against a sandboxed interpreter with simulated hardware.",
    subcommands = {
        ReplCommand.class,
        WorkerMain.class,
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

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("circuitrepl");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @throws CommandLine.ParameterException if an explicit configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config == null) {
            if (configFile != null && !configFile.exists()) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                    "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            try {
                config = ConfigLoader.load(configFile);
            } catch (ConfigException e) {
                LOGGER.error("Failed to load or parse configuration: {}", e.getMessage());
                throw new CommandLine.ParameterException(new CommandLine(this), e.getMessage(), e, null, null);
            }
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
