package org.flightplot.export;

import java.awt.image.BufferedImage;

/**
 * Rasterizes frame descriptors into images.
 * <p>
 * The descriptor type is opaque to the pipeline; it only hands descriptors from the
 * caller's list to the rasterizer, read-only, one call at a time.
 * <p>
 * <strong>Thread Safety:</strong> implementations are not required to be thread-safe.
 * The worker pool calls {@link #createThreadInstance()} once per worker thread and
 * confines each instance to its thread.
 *
 * @param <D> frame descriptor type
 */
public interface IFrameRasterizer<D> {

    /**
     * Draws one frame at the profile's resolution and color encoding.
     * <p>
     * Reduced-palette profiles get a {@link BufferedImage#TYPE_BYTE_INDEXED} image
     * with at most the profile's palette size; full-color profiles get
     * {@link BufferedImage#TYPE_INT_RGB}. The returned image is owned by the caller.
     *
     * @param descriptor the chart state to draw.
     * @param profile    resolution, scale and color encoding.
     * @return a new image of {@link QualityProfile#pixelWidth()} x {@link QualityProfile#pixelHeight()}.
     * @throws FrameRenderException if the frame cannot be drawn.
     */
    BufferedImage rasterize(D descriptor, QualityProfile profile) throws FrameRenderException;

    /**
     * Creates an instance with the same configuration for use in another thread.
     *
     * @return a new rasterizer.
     */
    IFrameRasterizer<D> createThreadInstance();
}
