package org.flightplot.export;

import java.util.OptionalInt;

/**
 * Resource parameters of a quality tier.
 * <p>
 * The rasterized frame size is the target size multiplied by {@link #rasterScale()},
 * so the target size describes the chart layout and the scale trades pixels for speed.
 *
 * @param tier               canonical tier name, e.g. {@code fast-preview}
 * @param label              human-readable tier label used in progress output
 * @param targetWidth        layout width in pixels
 * @param targetHeight       layout height in pixels
 * @param rasterScale        multiplier applied to the layout size when rasterizing
 * @param maxFrameBudget     hard frame cap, empty for stride-only sampling
 * @param frameStepPolicy    maps the source frame count to stride and cap
 * @param perFrameDurationMs display time of each animation frame
 * @param colorEncoding      palette reduction or full color
 */
public record QualityProfile(String tier,
                             String label,
                             int targetWidth,
                             int targetHeight,
                             double rasterScale,
                             OptionalInt maxFrameBudget,
                             FrameStepPolicy frameStepPolicy,
                             int perFrameDurationMs,
                             ColorEncoding colorEncoding) {

    /**
     * Returns the width of a rasterized frame, never less than one pixel.
     *
     * @return scaled frame width.
     */
    public int pixelWidth() {
        return Math.max(1, (int) Math.round(targetWidth * rasterScale));
    }

    /**
     * Returns the height of a rasterized frame, never less than one pixel.
     *
     * @return scaled frame height.
     */
    public int pixelHeight() {
        return Math.max(1, (int) Math.round(targetHeight * rasterScale));
    }
}
