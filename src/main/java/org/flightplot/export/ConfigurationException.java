package org.flightplot.export;

/**
 * Thrown when a quality tier is unknown or its configured parameters are invalid.
 * <p>
 * Raised before any sampling or rendering work is started.
 */
public class ConfigurationException extends ExportException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
