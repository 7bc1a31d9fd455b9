package org.flightplot.export;

/**
 * Observer of an export request.
 * <p>
 * <strong>Threading:</strong> all callbacks run on the thread that called
 * {@link ExportPipeline#export}, never on a render worker. Implementations may update
 * UI state directly and may call {@link CancellationToken#cancel()}.
 */
@FunctionalInterface
public interface IProgressListener {

    /** Listener that ignores all events. */
    IProgressListener NONE = event -> { };

    /**
     * Called after each render result has been collected.
     *
     * @param event monotonic progress count.
     */
    void onProgress(ProgressEvent event);

    /**
     * Called when the request enters a new stage.
     *
     * @param stage the stage just entered.
     */
    default void onStageChanged(PipelineStage stage) {
    }
}
