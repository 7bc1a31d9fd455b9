package org.flightplot.export;

/**
 * Thrown by a rasterizer when a single frame cannot be drawn.
 * <p>
 * <strong>Error Handling Pattern:</strong> render workers catch this exception,
 * log it at WARN without the stack trace, and leave the frame's slot empty.
 * The remaining frames keep rendering.
 *
 * @see RenderWorkerPool
 */
public class FrameRenderException extends ExportException {

    /**
     * @param message the detail message explaining why the frame could not be drawn
     */
    public FrameRenderException(String message) {
        super(message);
    }

    /**
     * @param message the detail message explaining why the frame could not be drawn
     * @param cause the underlying cause
     */
    public FrameRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
