package org.flightplot.export;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects render results in completion order and restores slot order.
 * <p>
 * Runs on the caller's thread, which is also the only thread that touches progress
 * state: results are written into their pre-assigned slot, the completed count is
 * advanced and a {@link ProgressEvent} is emitted, all on this thread.
 * <p>
 * Cancellation is checked before every wait. Once observed, the batch is abandoned and
 * any result still in flight is discarded. The wait itself is a short poll rather than
 * an unbounded take so a cancel request from another thread is seen promptly.
 */
public class OrderedAggregator {

    private static final Logger log = LoggerFactory.getLogger(OrderedAggregator.class);

    /** Poll interval of the completion queue. */
    static final long POLL_INTERVAL_MS = 50;

    /**
     * Outcome of an aggregation run.
     *
     * @param cancelled whether cancellation was observed
     * @param frames    surviving frames in slot order, empty when cancelled
     */
    public record Outcome(boolean cancelled, List<BufferedImage> frames) {

        static Outcome cancelledOutcome() {
            return new Outcome(true, List.of());
        }
    }

    /**
     * Aggregates the results of a running batch.
     *
     * @see #aggregate(BlockingQueue, int, Runnable, PipelineState, IProgressListener, String)
     */
    public Outcome aggregate(RenderWorkerPool.RenderBatch batch, PipelineState state,
                             IProgressListener listener, String tierLabel) throws RenderFailureException {
        return aggregate(batch.completions(), batch.expectedResults(), batch::abandon, state, listener, tierLabel);
    }

    /**
     * Waits for {@code expected} results, stores them by slot and reports progress.
     *
     * @param completions single-consumer completion queue.
     * @param expected    number of results to wait for.
     * @param abandon     stops outstanding work when cancellation is observed.
     * @param state       request state holding the slots and counters.
     * @param listener    progress observer, called on this thread.
     * @param tierLabel   label included in progress events.
     * @return the surviving frames in slot order, or a cancelled outcome.
     * @throws RenderFailureException if all results arrived and none holds a frame.
     */
    public Outcome aggregate(BlockingQueue<RenderResult> completions, int expected, Runnable abandon,
                             PipelineState state, IProgressListener listener, String tierLabel)
            throws RenderFailureException {
        int received = 0;
        while (received < expected) {
            if (state.isCancelled()) {
                return abandon(abandon, received, expected);
            }

            RenderResult result;
            try {
                result = completions.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                state.cancellation().cancel();
                return abandon(abandon, received, expected);
            }
            if (result == null) {
                continue;
            }

            received++;
            int completed = state.record(result);
            listener.onProgress(new ProgressEvent(completed, expected, tierLabel));
        }

        if (state.isCancelled()) {
            return abandon(abandon, received, expected);
        }

        int filled = state.filledCount();
        if (filled == 0) {
            throw new RenderFailureException("All " + expected + " frame(s) failed to render");
        }
        if (filled < expected) {
            log.warn("{} of {} frame(s) failed to render and were skipped", expected - filled, expected);
        }
        return new Outcome(false, state.survivingFrames());
    }

    private Outcome abandon(Runnable abandon, int received, int expected) {
        log.info("Export cancelled after {} of {} frame(s)", received, expected);
        abandon.run();
        return Outcome.cancelledOutcome();
    }
}
