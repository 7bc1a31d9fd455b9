package org.flightplot.export;

/**
 * Progress of the rendering stage.
 *
 * @param completed number of frames accounted for so far (rendered, failed or skipped)
 * @param total     number of frames selected for rendering
 * @param tierLabel label of the quality tier being exported
 */
public record ProgressEvent(int completed, int total, String tierLabel) {

    public double fraction() {
        return total == 0 ? 1.0 : (double) completed / total;
    }
}
