package org.flightplot.chart;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Path2D;
import java.util.List;
import java.util.Locale;

import org.flightplot.export.AbstractFrameRasterizer;
import org.flightplot.export.FrameRenderException;
import org.flightplot.export.IFrameRasterizer;

/**
 * Draws a {@link ChartFrame} as a line chart.
 * <p>
 * Layout (in layout coordinates, scaled by the profile's raster scale):
 * <ul>
 *   <li>Title centered at the top, legend along the top right</li>
 *   <li>Light grid with five horizontal divisions, black axes</li>
 *   <li>Row labels (index text or row number) under the first, middle and last row</li>
 *   <li>One polyline per series over the visible rows, colored from the Set1 palette</li>
 *   <li>A highlight marker on each series' newest point, labelled {@code name: value}</li>
 * </ul>
 * The x axis spans all rows of the chart and the y axis the chart's full value range, so
 * consecutive frames line up.
 */
public class LineChartRasterizer extends AbstractFrameRasterizer<ChartFrame> {

    /** Qualitative Set1 palette. */
    static final Color[] SERIES_COLORS = {
        new Color(0xE41A1C), new Color(0x377EB8), new Color(0x4DAF4A),
        new Color(0x984EA3), new Color(0xFF7F00), new Color(0xFFFF33),
        new Color(0xA65628), new Color(0xF781BF), new Color(0x999999)
    };

    private static final Color BACKGROUND = Color.WHITE;
    private static final Color GRID_COLOR = new Color(211, 211, 211);
    private static final Color AXIS_COLOR = Color.BLACK;
    private static final Color TEXT_COLOR = new Color(40, 40, 40);

    private static final int GRID_DIVISIONS = 5;
    private static final int MIN_FONT_SIZE = 6;

    private final boolean showLabels;

    public LineChartRasterizer() {
        this(true);
    }

    /**
     * @param showLabels whether to draw title, legend, tick and value labels.
     */
    public LineChartRasterizer(boolean showLabels) {
        this.showLabels = showLabels;
    }

    @Override
    public IFrameRasterizer<ChartFrame> createThreadInstance() {
        return new LineChartRasterizer(showLabels);
    }

    @Override
    protected void draw(ChartFrame frame, Graphics2D g2d, int width, int height) throws FrameRenderException {
        TimeSeriesChart chart = frame.chart();
        if (frame.visiblePoints() < 1 || frame.visiblePoints() > chart.pointCount()) {
            throw new FrameRenderException("Frame " + frame.index() + " shows " + frame.visiblePoints()
                + " point(s) but the chart has " + chart.pointCount());
        }

        int fontSize = Math.max(MIN_FONT_SIZE, height / 22);
        Font font = new Font(Font.SANS_SERIF, Font.PLAIN, fontSize);
        g2d.setFont(font);

        int left = showLabels ? Math.max(fontSize * 4, width / 9) : width / 20;
        int right = Math.max(4, width / 25);
        int top = showLabels ? fontSize * 3 : height / 20;
        int bottom = showLabels ? fontSize * 2 : height / 20;
        int plotWidth = Math.max(1, width - left - right);
        int plotHeight = Math.max(1, height - top - bottom);

        g2d.setColor(BACKGROUND);
        g2d.fillRect(0, 0, width, height);

        drawGrid(g2d, chart, left, top, plotWidth, plotHeight);

        List<String> series = chart.series();
        float lineWidth = Math.max(1.5f, height / 300.0f);
        for (int s = 0; s < series.size(); s++) {
            Color color = SERIES_COLORS[s % SERIES_COLORS.length];
            drawSeries(g2d, frame, series.get(s), color, lineWidth, left, top, plotWidth, plotHeight);
        }

        if (showLabels) {
            drawTitleAndLegend(g2d, chart, width, fontSize);
        }
    }

    private void drawGrid(Graphics2D g2d, TimeSeriesChart chart, int left, int top, int plotWidth, int plotHeight) {
        g2d.setStroke(new BasicStroke(1));
        FontMetrics metrics = g2d.getFontMetrics();
        for (int i = 0; i <= GRID_DIVISIONS; i++) {
            int y = top + plotHeight - (plotHeight * i / GRID_DIVISIONS);
            g2d.setColor(GRID_COLOR);
            g2d.drawLine(left, y, left + plotWidth, y);
            if (showLabels) {
                double value = chart.minValue() + (chart.maxValue() - chart.minValue()) * i / GRID_DIVISIONS;
                String label = formatValue(value);
                g2d.setColor(TEXT_COLOR);
                g2d.drawString(label, left - metrics.stringWidth(label) - 3, y + metrics.getAscent() / 2);
            }
        }

        g2d.setColor(AXIS_COLOR);
        g2d.drawLine(left, top + plotHeight, left + plotWidth, top + plotHeight);
        g2d.drawLine(left, top, left, top + plotHeight);

        if (showLabels) {
            drawRowTicks(g2d, chart, left, top + plotHeight, plotWidth);
        }
    }

    /** Labels the first, middle and last row under the x axis with their index text. */
    private void drawRowTicks(Graphics2D g2d, TimeSeriesChart chart, int left, int axisY, int plotWidth) {
        int points = chart.pointCount();
        int[] rows = points > 2 ? new int[]{0, (points - 1) / 2, points - 1}
            : points == 2 ? new int[]{0, 1} : new int[]{0};
        FontMetrics metrics = g2d.getFontMetrics();
        int textY = axisY + metrics.getAscent() + 3;
        for (int row : rows) {
            String label = chart.table().rowLabel(row);
            int x = (int) Math.round(xFor(row, points, left, plotWidth));
            int textWidth = metrics.stringWidth(label);
            int textX = Math.max(0, Math.min(x - textWidth / 2, left + plotWidth - textWidth));
            g2d.setColor(AXIS_COLOR);
            g2d.drawLine(x, axisY, x, axisY + 3);
            g2d.setColor(TEXT_COLOR);
            g2d.drawString(label, textX, textY);
        }
    }

    private void drawSeries(Graphics2D g2d, ChartFrame frame, String column, Color color, float lineWidth,
                            int left, int top, int plotWidth, int plotHeight) {
        TimeSeriesChart chart = frame.chart();
        SeriesTable table = chart.table();
        int points = frame.visiblePoints();

        Path2D.Double path = new Path2D.Double();
        for (int row = 0; row < points; row++) {
            double x = xFor(row, chart.pointCount(), left, plotWidth);
            double y = yFor(table.value(column, row), chart, top, plotHeight);
            if (row == 0) {
                path.moveTo(x, y);
            } else {
                path.lineTo(x, y);
            }
        }

        g2d.setColor(color);
        g2d.setStroke(new BasicStroke(lineWidth, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
        if (points >= 2) {
            g2d.draw(path);
        }

        int latest = frame.latestRow();
        double value = table.value(column, latest);
        double lx = xFor(latest, chart.pointCount(), left, plotWidth);
        double ly = yFor(value, chart, top, plotHeight);
        double radius = Math.max(3, plotHeight / 40.0);

        Ellipse2D.Double marker = new Ellipse2D.Double(lx - radius, ly - radius, radius * 2, radius * 2);
        g2d.fill(marker);
        g2d.setColor(Color.WHITE);
        g2d.setStroke(new BasicStroke(Math.max(1f, lineWidth)));
        g2d.draw(marker);

        if (showLabels) {
            String label = column + ": " + String.format(Locale.ROOT, "%.2f", value);
            FontMetrics metrics = g2d.getFontMetrics();
            int textX = (int) Math.round(lx - metrics.stringWidth(label) / 2.0);
            textX = Math.max(left, Math.min(textX, left + plotWidth - metrics.stringWidth(label)));
            int textY = (int) Math.round(ly - radius - 2);
            textY = Math.max(top + metrics.getAscent(), textY);
            g2d.setColor(color);
            g2d.drawString(label, textX, textY);
        }
    }

    private void drawTitleAndLegend(Graphics2D g2d, TimeSeriesChart chart, int width, int fontSize) {
        FontMetrics metrics = g2d.getFontMetrics();
        if (!chart.title().isEmpty()) {
            g2d.setColor(TEXT_COLOR);
            g2d.drawString(chart.title(), (width - metrics.stringWidth(chart.title())) / 2, fontSize + 2);
        }

        int x = width - Math.max(4, width / 25);
        int y = fontSize * 2 + 2;
        List<String> series = chart.series();
        for (int s = series.size() - 1; s >= 0; s--) {
            String name = series.get(s);
            int textWidth = metrics.stringWidth(name);
            x -= textWidth;
            g2d.setColor(TEXT_COLOR);
            g2d.drawString(name, x, y);
            x -= fontSize + 2;
            g2d.setColor(SERIES_COLORS[s % SERIES_COLORS.length]);
            g2d.fillRect(x, y - fontSize / 2 - 1, fontSize, Math.max(2, fontSize / 4));
            x -= fontSize;
        }
    }

    private static double xFor(int row, int pointCount, int left, int plotWidth) {
        if (pointCount <= 1) {
            return left + plotWidth / 2.0;
        }
        return left + (double) plotWidth * row / (pointCount - 1);
    }

    private static double yFor(double value, TimeSeriesChart chart, int top, int plotHeight) {
        double range = chart.maxValue() - chart.minValue();
        double fraction = (value - chart.minValue()) / range;
        return top + plotHeight - fraction * plotHeight;
    }

    private static String formatValue(double value) {
        double magnitude = Math.abs(value);
        if (magnitude >= 10000 || (magnitude > 0 && magnitude < 0.01)) {
            return String.format(Locale.ROOT, "%.1e", value);
        }
        if (magnitude >= 100) {
            return String.format(Locale.ROOT, "%.0f", value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
