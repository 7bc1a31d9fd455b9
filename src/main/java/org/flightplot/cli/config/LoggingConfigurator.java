package org.flightplot.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} configuration section to Logback.
 * <pre>
 * logging {
 *   level = INFO
 *   levels { "org.flightplot.export" = DEBUG }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level and per-logger levels found in the configuration.
     * Does nothing when SLF4J is not bound to Logback.
     *
     * @param config the application configuration.
     */
    public static void configure(Config config) {
        LoggerContext context = loggerContext();
        if (context == null) {
            return;
        }
        if (config.hasPath("logging.level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(config.getString("logging.level"), Level.INFO));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.levels").root().entrySet()) {
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(level, Level.INFO));
            }
        }
    }

    /**
     * Raises the level of the application's loggers to DEBUG.
     */
    public static void enableDebug() {
        LoggerContext context = loggerContext();
        if (context != null) {
            context.getLogger("org.flightplot").setLevel(Level.DEBUG);
        }
    }

    private static LoggerContext loggerContext() {
        return LoggerFactory.getILoggerFactory() instanceof LoggerContext context ? context : null;
    }
}
