package org.flightplot.chart;

/**
 * Chart state after a number of data points: the frame descriptor of an animated chart.
 *
 * @param chart         the chart the frame belongs to
 * @param index         frame position in the chart's frame list
 * @param visiblePoints number of leading data points drawn in this frame
 */
public record ChartFrame(TimeSeriesChart chart, int index, int visiblePoints) {

    /**
     * Returns the row index of the newest visible data point.
     *
     * @return the last visible row.
     */
    public int latestRow() {
        return visiblePoints - 1;
    }
}
