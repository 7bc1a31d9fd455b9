package org.flightplot.export;

import org.flightplot.export.gif.GifAnimationEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the animated-chart export.
 * <p>
 * Stages, in order:
 * <ol>
 *   <li><strong>CONFIGURING:</strong> resolve the quality tier, failing fast on unknown tiers</li>
 *   <li><strong>SAMPLING:</strong> select the frame indices to render</li>
 *   <li><strong>RENDERING / AGGREGATING:</strong> fan frames out to the {@link RenderWorkerPool}
 *       and collect them back in sampling order on the calling thread</li>
 *   <li><strong>ENCODING:</strong> assemble the surviving frames into a looping animation</li>
 * </ol>
 * {@link #export} runs on the caller's thread and returns exactly one terminal
 * {@link ExportResult}; it does not throw. Progress and stage callbacks are delivered on
 * the same thread. Each call creates its own {@link PipelineState}, so one pipeline
 * instance can serve consecutive requests.
 *
 * @param <D> frame descriptor type
 */
public class ExportPipeline<D> {

    private static final Logger log = LoggerFactory.getLogger(ExportPipeline.class);

    private final QualityProfileResolver resolver;
    private final RenderWorkerPool<D> workerPool;
    private final OrderedAggregator aggregator;
    private final IAnimationEncoder encoder;

    public ExportPipeline(QualityProfileResolver resolver, RenderWorkerPool<D> workerPool,
                          OrderedAggregator aggregator, IAnimationEncoder encoder) {
        this.resolver = resolver;
        this.workerPool = workerPool;
        this.aggregator = aggregator;
        this.encoder = encoder;
    }

    /**
     * Creates a pipeline writing GIF animations.
     *
     * @param resolver   quality tier table.
     * @param rasterizer configured rasterizer; copied once per worker thread.
     * @param maxWorkers upper bound of concurrent render workers.
     */
    public ExportPipeline(QualityProfileResolver resolver, IFrameRasterizer<D> rasterizer, int maxWorkers) {
        this(resolver, new RenderWorkerPool<>(rasterizer, maxWorkers), new OrderedAggregator(),
            new GifAnimationEncoder());
    }

    /**
     * Runs one export request to completion, cancellation or failure.
     *
     * @param request  frames, tier and cancel signal.
     * @param listener progress and stage observer, called on this thread.
     * @return the terminal result.
     */
    public ExportResult export(PipelineRequest<D> request, IProgressListener listener) {
        long startTime = System.currentTimeMillis();
        Tracker tracker = new Tracker(listener);
        ExportResult result;
        try {
            result = run(request, listener, tracker);
        } catch (ExportException e) {
            log.error("Export failed during {}: {}", tracker.stage, e.getMessage());
            result = ExportResult.failed(tracker.stage, e);
        } catch (RuntimeException e) {
            log.error("Export failed during {} with unexpected {}: {}",
                tracker.stage, e.getClass().getSimpleName(), e.getMessage());
            log.debug("Unexpected export failure", e);
            result = ExportResult.failed(tracker.stage, new ExportException("Unexpected failure: " + e.getMessage(), e));
        }

        listener.onStageChanged(result.terminalStage());
        if (result.isCompleted()) {
            log.info("Export finished in {} ms: {}", System.currentTimeMillis() - startTime, result);
        }
        return result;
    }

    private ExportResult run(PipelineRequest<D> request, IProgressListener listener, Tracker tracker)
            throws ExportException {
        CancellationToken cancellation = request.cancellation();

        tracker.enter(PipelineStage.CONFIGURING);
        if (cancellation.isCancelled()) {
            return cancelled(tracker);
        }
        ResolvedProfile resolved = resolver.resolve(request.tierName(), request.frames().size());
        QualityProfile profile = resolved.profile();

        tracker.enter(PipelineStage.SAMPLING);
        if (request.frames().isEmpty()) {
            throw new RenderFailureException("No frames to render");
        }
        SampledIndices indices = resolved.sample();
        log.info("Exporting {} of {} frame(s) with tier '{}' ({}x{}, {})",
            indices.size(), request.frames().size(), profile.label(),
            profile.pixelWidth(), profile.pixelHeight(), profile.colorEncoding());
        log.debug("Sampled frames (stride={}): {}", resolved.stride(), FrameSampler.describe(indices));

        PipelineState state = new PipelineState(cancellation, indices.size());
        if (state.isCancelled()) {
            return cancelled(tracker);
        }

        tracker.enter(PipelineStage.RENDERING);
        RenderWorkerPool.RenderBatch batch = workerPool.start(request.frames(), indices, profile, state);
        OrderedAggregator.Outcome outcome;
        try {
            tracker.enter(PipelineStage.AGGREGATING);
            outcome = aggregator.aggregate(batch, state, listener, profile.label());
        } finally {
            batch.abandon();
        }
        if (outcome.cancelled() || state.isCancelled()) {
            return cancelled(tracker);
        }

        tracker.enter(PipelineStage.ENCODING);
        AnimatedArtifact artifact = encoder.encode(outcome.frames(), profile.perFrameDurationMs(),
            profile.colorEncoding());
        return ExportResult.completed(artifact);
    }

    private ExportResult cancelled(Tracker tracker) {
        log.info("Export cancelled during {}", tracker.stage);
        return ExportResult.cancelled(tracker.stage);
    }

    /**
     * Current stage, reported to the listener on every transition.
     */
    private static final class Tracker {

        private final IProgressListener listener;
        private PipelineStage stage = PipelineStage.CONFIGURING;

        Tracker(IProgressListener listener) {
            this.listener = listener;
        }

        void enter(PipelineStage next) {
            stage = next;
            listener.onStageChanged(next);
        }
    }
}
