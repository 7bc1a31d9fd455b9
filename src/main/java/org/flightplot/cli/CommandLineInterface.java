package org.flightplot.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.flightplot.cli.commands.ExportAnimationCommand;
import org.flightplot.cli.commands.ListTiersCommand;
import org.flightplot.cli.config.ConfigLoader;
import org.flightplot.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "flightplot",
    mixinStandardHelpOptions = true,
    version = "Flightplot 1.0",
    description = "Flightplot - animated chart export for flight decode data",
    subcommands = {
        ExportAnimationCommand.class,
        ListTiersCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code of a successful run. */
    public static final int EXIT_OK = 0;
    /** Exit code of a failed run. */
    public static final int EXIT_FAILURE = 1;
    /** Exit code of a run cancelled by the user (128 + SIGINT). */
    public static final int EXIT_CANCELLED = 130;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/flightplot.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // No subcommand given
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("flightplot");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration.
     * @throws IllegalArgumentException if the configuration file does not exist.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }

    private void initialize() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.debug(message);
                case WARN -> logger.warn(message);
            }
        });

        // logback.xml starts with colored output
        if (config.hasPath("logging.format") && "PLAIN".equalsIgnoreCase(config.getString("logging.format"))) {
            System.setProperty("flightplot.logging.format", "CONSOLE_PLAIN");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
