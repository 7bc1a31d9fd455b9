package org.flightplot.export;

import java.awt.image.BufferedImage;

/**
 * Completion event published by a render worker for one slot.
 *
 * @param slotIndex  position in the sampled sequence
 * @param frameIndex position in the source frame list
 * @param status     outcome of the task
 * @param image      the rasterized frame, {@code null} unless {@link Status#RENDERED}
 */
public record RenderResult(int slotIndex, int frameIndex, Status status, BufferedImage image) {

    public enum Status {
        /** Frame rasterized. */
        RENDERED,
        /** Rasterization failed, slot stays empty. */
        FAILED,
        /** Cancellation was observed, slot stays empty. */
        SKIPPED
    }

    public static RenderResult rendered(int slotIndex, int frameIndex, BufferedImage image) {
        return new RenderResult(slotIndex, frameIndex, Status.RENDERED, image);
    }

    public static RenderResult failed(int slotIndex, int frameIndex) {
        return new RenderResult(slotIndex, frameIndex, Status.FAILED, null);
    }

    public static RenderResult skipped(int slotIndex, int frameIndex) {
        return new RenderResult(slotIndex, frameIndex, Status.SKIPPED, null);
    }

    public boolean hasImage() {
        return image != null;
    }
}
