package org.flightplot.export;

/**
 * Thrown when no rendered frame survived, so there is nothing to encode.
 */
public class RenderFailureException extends ExportException {

    public RenderFailureException(String message) {
        super(message);
    }
}
