package org.flightplot.chart;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-series line chart over the rows of a {@link SeriesTable}.
 * <p>
 * The chart is animated point by point: frame {@code i} shows rows {@code 0..i}. The first
 * frame already shows two points when the table has more than one row, so it draws a line
 * instead of a lone marker. Axis ranges are computed once over all rows so that frames do
 * not rescale while the animation plays.
 */
public final class TimeSeriesChart {

    /** Relative padding added above and below the value range. */
    private static final double RANGE_PADDING = 0.05;

    private final SeriesTable table;
    private final List<String> series;
    private final String title;
    private final double minValue;
    private final double maxValue;

    /**
     * @param table  data source.
     * @param series columns to plot, in legend order.
     * @param title  chart title, may be empty.
     * @throws IllegalArgumentException if no series is given, or a column is unknown, is the
     *                                  row index or holds no numbers.
     */
    public TimeSeriesChart(SeriesTable table, List<String> series, String title) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("At least one series is required");
        }
        for (String name : series) {
            if (table.indexColumn().filter(name::equals).isPresent()) {
                throw new IllegalArgumentException("Column '" + name + "' is the row index and cannot be plotted");
            }
            if (!table.hasColumn(name)) {
                throw new IllegalArgumentException("Unknown column '" + name + "'. Known columns: "
                    + table.columnNames());
            }
            if (!table.isNumeric(name)) {
                throw new IllegalArgumentException("Column '" + name + "' holds no numbers. Numeric columns: "
                    + table.numericColumnNames());
            }
        }
        this.table = table;
        this.series = List.copyOf(series);
        this.title = title == null ? "" : title;

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (String name : this.series) {
            for (int row = 0; row < table.rowCount(); row++) {
                double v = table.value(name, row);
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
        }
        if (min > max) {
            min = 0;
            max = 1;
        }
        if (max - min < 1e-12) {
            double pad = Math.max(1.0, Math.abs(max) * RANGE_PADDING);
            min -= pad;
            max += pad;
        } else {
            double pad = (max - min) * RANGE_PADDING;
            min -= pad;
            max += pad;
        }
        this.minValue = min;
        this.maxValue = max;
    }

    /**
     * Creates a chart over the first numeric columns of a table.
     *
     * @param table     data source.
     * @param maxSeries upper bound of plotted columns.
     * @param title     chart title, may be empty.
     * @return the chart.
     * @throws IllegalArgumentException if the table has no numeric column.
     */
    public static TimeSeriesChart ofNumericColumns(SeriesTable table, int maxSeries, String title) {
        List<String> numeric = table.numericColumnNames();
        if (numeric.isEmpty()) {
            throw new IllegalArgumentException("No numeric columns to plot. Columns: " + table.columnNames());
        }
        return new TimeSeriesChart(table, numeric.subList(0, Math.min(Math.max(1, maxSeries), numeric.size())), title);
    }

    /**
     * Builds one frame per data point.
     *
     * @return frames in chart order; empty if the table has no rows.
     */
    public List<ChartFrame> frames() {
        int rows = table.rowCount();
        List<ChartFrame> frames = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            int visible = (i == 0 && rows > 1) ? 2 : i + 1;
            frames.add(new ChartFrame(this, i, visible));
        }
        return frames;
    }

    public SeriesTable table() {
        return table;
    }

    public List<String> series() {
        return series;
    }

    public String title() {
        return title;
    }

    public int pointCount() {
        return table.rowCount();
    }

    public double minValue() {
        return minValue;
    }

    public double maxValue() {
        return maxValue;
    }
}
