package org.flightplot.export;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

import org.flightplot.export.gif.MedianCutQuantizer;

/**
 * Base class for rasterizers that draw with {@link Graphics2D}.
 * <p>
 * Provides:
 * <ul>
 *   <li>A canvas sized to the profile's pixel size, reused across frames of the same size</li>
 *   <li>Layout in target coordinates: the graphics context is pre-scaled by the raster scale</li>
 *   <li>Color encoding via Template Method: paletted tiers are quantized straight from the
 *       canvas, full-color tiers get a copy of it</li>
 * </ul>
 * Subclasses implement {@link #draw(Object, Graphics2D, int, int)} and
 * {@link #createThreadInstance()}.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe because the canvas is reused.
 *
 * @param <D> frame descriptor type
 */
public abstract class AbstractFrameRasterizer<D> implements IFrameRasterizer<D> {

    private BufferedImage canvas;

    @Override
    public final BufferedImage rasterize(D descriptor, QualityProfile profile) throws FrameRenderException {
        if (descriptor == null) {
            throw new FrameRenderException("No frame descriptor");
        }
        BufferedImage target = canvasFor(profile.pixelWidth(), profile.pixelHeight());

        Graphics2D g2d = target.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
            double sx = (double) target.getWidth() / profile.targetWidth();
            double sy = (double) target.getHeight() / profile.targetHeight();
            g2d.scale(sx, sy);
            draw(descriptor, g2d, profile.targetWidth(), profile.targetHeight());
        } catch (RuntimeException e) {
            throw new FrameRenderException("Drawing failed: " + e.getMessage(), e);
        } finally {
            g2d.dispose();
        }

        ColorEncoding encoding = profile.colorEncoding();
        if (encoding.isReducedPalette()) {
            return MedianCutQuantizer.quantize(target, encoding.colors());
        }
        return copyOf(target);
    }

    /**
     * Draws one frame in layout coordinates.
     *
     * @param descriptor   the chart state to draw.
     * @param g2d          graphics context scaled from layout to pixel coordinates.
     * @param layoutWidth  layout width (the profile's target width).
     * @param layoutHeight layout height (the profile's target height).
     * @throws FrameRenderException if the descriptor cannot be drawn.
     */
    protected abstract void draw(D descriptor, Graphics2D g2d, int layoutWidth, int layoutHeight)
            throws FrameRenderException;

    private BufferedImage canvasFor(int width, int height) {
        if (canvas == null || canvas.getWidth() != width || canvas.getHeight() != height) {
            canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        }
        return canvas;
    }

    private static BufferedImage copyOf(BufferedImage source) {
        BufferedImage copy = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        // Clone because the canvas is reused for the next frame
        source.copyData(copy.getRaster());
        return copy;
    }
}
