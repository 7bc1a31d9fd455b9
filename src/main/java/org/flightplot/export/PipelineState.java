package org.flightplot.export;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable state of one export request.
 * <p>
 * Created fresh per request and discarded once the request has reached a terminal
 * stage. The slot array is pre-sized to the sampled frame count and every slot is
 * written at most once, so slots need no locking. Only the aggregator thread calls
 * {@link #record(RenderResult)}; workers only read the cancellation flag.
 */
public final class PipelineState {

    private final CancellationToken cancellation;
    private final BufferedImage[] slots;
    private final AtomicInteger completedCount = new AtomicInteger();
    private int filledCount;

    public PipelineState(CancellationToken cancellation, int slotCount) {
        this.cancellation = cancellation;
        this.slots = new BufferedImage[slotCount];
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    /**
     * Stores a worker result in its slot and advances the completed count.
     *
     * @param result the result to store.
     * @return the new completed count.
     * @throws IllegalStateException if the slot already holds a frame.
     */
    int record(RenderResult result) {
        int slot = result.slotIndex();
        if (result.hasImage()) {
            if (slots[slot] != null) {
                throw new IllegalStateException("Slot " + slot + " written twice");
            }
            slots[slot] = result.image();
            filledCount++;
        }
        return completedCount.incrementAndGet();
    }

    public int completedCount() {
        return completedCount.get();
    }

    /**
     * Number of slots holding a rendered frame. Aggregator thread only.
     *
     * @return filled slot count.
     */
    int filledCount() {
        return filledCount;
    }

    /**
     * Returns the rendered frames in slot order, skipping empty slots.
     *
     * @return surviving frames.
     */
    List<BufferedImage> survivingFrames() {
        List<BufferedImage> frames = new ArrayList<>(filledCount);
        for (BufferedImage slot : slots) {
            if (slot != null) {
                frames.add(slot);
            }
        }
        return frames;
    }
}
