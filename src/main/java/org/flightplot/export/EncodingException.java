package org.flightplot.export;

/**
 * Thrown when the animation encoder rejects the rendered frames.
 * <p>
 * Terminal and non-retryable for the export request that raised it.
 */
public class EncodingException extends ExportException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
