package org.flightplot.export;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded pool of render workers.
 * <p>
 * {@link #start} sizes a fixed thread pool to {@code min(maxWorkers, selected frames)}
 * and queues one task per slot. Idle workers pull the next unclaimed slot from the
 * pool's work queue. Each task:
 * <ol>
 *   <li>checks cancellation and skips the frame if set</li>
 *   <li>rasterizes the frame with its thread's own rasterizer instance</li>
 *   <li>checks cancellation again and drops the image if set</li>
 *   <li>publishes exactly one {@link RenderResult} to the batch's completion queue</li>
 * </ol>
 * A frame that fails to rasterize is logged and published as {@link RenderResult.Status#FAILED};
 * it never aborts the other tasks. Workers never wait on each other and never touch
 * progress state: the completion queue has a single consumer, the {@link OrderedAggregator}.
 *
 * @param <D> frame descriptor type
 */
public class RenderWorkerPool<D> {

    private static final Logger log = LoggerFactory.getLogger(RenderWorkerPool.class);

    /** Default upper bound of concurrent render workers. */
    public static final int DEFAULT_MAX_WORKERS = 8;

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final IFrameRasterizer<D> prototype;
    private final int maxWorkers;

    /**
     * @param prototype  configured rasterizer; each worker thread gets its own copy.
     * @param maxWorkers upper bound of concurrent workers.
     */
    public RenderWorkerPool(IFrameRasterizer<D> prototype, int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1: " + maxWorkers);
        }
        this.prototype = prototype;
        this.maxWorkers = maxWorkers;
    }

    public RenderWorkerPool(IFrameRasterizer<D> prototype) {
        this(prototype, DEFAULT_MAX_WORKERS);
    }

    /**
     * Returns the number of workers used for a number of selected frames.
     *
     * @param selectedFrames frames to render.
     * @return {@code min(maxWorkers, selectedFrames)}, at least 1.
     */
    public int workerCountFor(int selectedFrames) {
        return Math.max(1, Math.min(maxWorkers, selectedFrames));
    }

    /**
     * Queues all selected frames for rendering and returns immediately.
     *
     * @param frames  source frame descriptors, read-only.
     * @param indices selected positions; slot {@code k} renders {@code frames.get(indices.get(k))}.
     * @param profile resolution, scale and color encoding.
     * @param state   shared request state, read for cancellation only.
     * @return handle to the running batch.
     */
    public RenderBatch start(List<D> frames, SampledIndices indices, QualityProfile profile, PipelineState state) {
        int workers = workerCountFor(indices.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        ThreadLocal<IFrameRasterizer<D>> rasterizers = ThreadLocal.withInitial(prototype::createThreadInstance);
        BlockingQueue<RenderResult> completions = new LinkedBlockingQueue<>();

        log.debug("Starting {} render worker(s) for {} frame(s) at {}x{}",
            workers, indices.size(), profile.pixelWidth(), profile.pixelHeight());

        RenderBatch batch = new RenderBatch(executor, completions, indices.size(), workers);
        for (int slot = 0; slot < indices.size(); slot++) {
            final int slotIndex = slot;
            final int frameIndex = indices.get(slot);
            executor.execute(() -> renderSlot(slotIndex, frameIndex, frames, profile, state,
                rasterizers, completions));
        }
        executor.shutdown();
        return batch;
    }

    private void renderSlot(int slotIndex, int frameIndex, List<D> frames, QualityProfile profile,
                            PipelineState state, ThreadLocal<IFrameRasterizer<D>> rasterizers,
                            BlockingQueue<RenderResult> completions) {
        RenderResult result = RenderResult.failed(slotIndex, frameIndex);
        try {
            if (state.isCancelled()) {
                result = RenderResult.skipped(slotIndex, frameIndex);
                return;
            }
            BufferedImage image = rasterizers.get().rasterize(frames.get(frameIndex), profile);
            result = state.isCancelled()
                ? RenderResult.skipped(slotIndex, frameIndex)
                : RenderResult.rendered(slotIndex, frameIndex, image);
        } catch (FrameRenderException e) {
            log.warn("Skipping frame {} (slot {}): {}", frameIndex, slotIndex, e.getMessage());
            log.debug("Frame {} render failure", frameIndex, e);
        } catch (RuntimeException e) {
            log.warn("Skipping frame {} (slot {}): unexpected {}: {}",
                frameIndex, slotIndex, e.getClass().getSimpleName(), e.getMessage());
            log.debug("Frame {} render failure", frameIndex, e);
        } finally {
            completions.add(result);
        }
    }

    private static ThreadFactory workerThreadFactory() {
        int pool = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "frame-render-" + pool + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * A running set of render tasks and its completion queue.
     */
    public static final class RenderBatch {

        private final ExecutorService executor;
        private final BlockingQueue<RenderResult> completions;
        private final int expectedResults;
        private final int workerCount;

        RenderBatch(ExecutorService executor, BlockingQueue<RenderResult> completions,
                    int expectedResults, int workerCount) {
            this.executor = executor;
            this.completions = completions;
            this.expectedResults = expectedResults;
            this.workerCount = workerCount;
        }

        /**
         * Single-consumer queue receiving one result per slot, in completion order.
         *
         * @return the completion queue.
         */
        public BlockingQueue<RenderResult> completions() {
            return completions;
        }

        public int expectedResults() {
            return expectedResults;
        }

        public int workerCount() {
            return workerCount;
        }

        /**
         * Stops dispatching queued slots and interrupts idle workers. Frames already being
         * rasterized run to completion and their results are ignored.
         */
        public void abandon() {
            executor.shutdownNow();
        }

        public boolean isTerminated() {
            return executor.isTerminated();
        }
    }
}
