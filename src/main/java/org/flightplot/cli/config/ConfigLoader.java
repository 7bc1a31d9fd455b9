package org.flightplot.cli.config;

import java.io.File;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the application configuration for the CLI.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dflightplot.export.max-workers=4})</li>
 *   <li>Environment variables</li>
 *   <li>The selected configuration file, if any</li>
 *   <li>{@code reference.conf} on the classpath (the built-in tier table)</li>
 * </ol>
 * Substitutions are resolved after all layers are merged, so a user file may override
 * values that {@code reference.conf} references.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "flightplot.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives messages about which configuration source was picked.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Picks the configuration file and loads it:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file given with {@code -Dconfig.file}</li>
     *   <li>{@code config/flightplot.conf} in the working directory</li>
     *   <li>classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile file from the command line, or {@code null}.
     * @param handler            receives resolution messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                    "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                "Using configuration file specified via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                    "Configuration file specified via -Dconfig.file not found: " + systemConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                "Using configuration file specified via -Dconfig.file: " + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                "Using configuration file found in current directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        handler.log(MessageLevel.INFO,
            "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found, using built-in defaults.");
        return loadDefaults();
    }

    static Config loadFromFile(File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }
}
