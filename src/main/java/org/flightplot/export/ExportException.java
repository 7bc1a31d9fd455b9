package org.flightplot.export;

/**
 * Base type for failures raised by the animation export pipeline.
 * <p>
 * Subtypes identify the stage that failed. Per-frame failures
 * ({@link FrameRenderException}) are absorbed by the render workers and never
 * reach the caller; all other subtypes end the export request.
 */
public class ExportException extends Exception {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
