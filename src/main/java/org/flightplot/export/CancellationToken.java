package org.flightplot.export;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one export request.
 * <p>
 * The flag moves from "running" to "cancelled" once and never back. Any thread may
 * cancel; workers and the aggregator poll {@link #isCancelled()}, which never blocks.
 * Work already handed to a worker is not interrupted, its result is discarded.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Requests cancellation.
     *
     * @return {@code true} if this call set the flag, {@code false} if it was already set.
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
