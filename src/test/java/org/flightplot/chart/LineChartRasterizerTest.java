package org.flightplot.chart;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import org.flightplot.export.ColorEncoding;
import org.flightplot.export.FrameStepPolicy;
import org.flightplot.export.IFrameRasterizer;
import org.flightplot.export.QualityProfile;
import org.flightplot.export.FrameRenderException;
import org.flightplot.export.gif.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LineChartRasterizer}.
 */
@Tag("unit")
class LineChartRasterizerTest {

    private TimeSeriesChart chart;

    @BeforeEach
    void setUp() {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("altitude", new double[]{0, 4, 9, 3, 7, 10});
        columns.put("speed", new double[]{10, 8, 6, 4, 2, 0});
        chart = new TimeSeriesChart(new SeriesTable(columns, Map.of("altitude", true, "speed", true)),
            List.of("altitude", "speed"), "Flight");
    }

    @Test
    void fullColorFrameHasProfilePixelSize() throws Exception {
        BufferedImage image = new LineChartRasterizer().rasterize(chart.frames().get(3), profile(0.5, ColorEncoding.fullColor()));

        assertThat(image.getWidth()).isEqualTo(100);
        assertThat(image.getHeight()).isEqualTo(75);
        assertThat(image.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
        assertThat(image.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0xFFFFFF);
        assertThat(TestImages.countColors(image)).isGreaterThan(3);
    }

    @Test
    void palettedFrameIsIndexed() throws Exception {
        BufferedImage image = new LineChartRasterizer(false)
            .rasterize(chart.frames().get(5), profile(1.0, ColorEncoding.reducedPalette(16)));

        assertThat(image.getType()).isEqualTo(BufferedImage.TYPE_BYTE_INDEXED);
        assertThat(((IndexColorModel) image.getColorModel()).getMapSize()).isLessThanOrEqualTo(16);
    }

    @Test
    void frameImagesAreIndependentCopies() throws Exception {
        LineChartRasterizer rasterizer = new LineChartRasterizer(false);
        QualityProfile profile = profile(1.0, ColorEncoding.fullColor());

        BufferedImage first = rasterizer.rasterize(chart.frames().get(1), profile);
        int[] before = first.getRGB(0, 0, first.getWidth(), first.getHeight(), null, 0, first.getWidth());
        BufferedImage last = rasterizer.rasterize(chart.frames().get(5), profile);
        int[] after = first.getRGB(0, 0, first.getWidth(), first.getHeight(), null, 0, first.getWidth());

        assertThat(after).isEqualTo(before);
        assertThat(last).isNotSameAs(first);
    }

    @Test
    void threadInstanceKeepsConfiguration() throws Exception {
        LineChartRasterizer prototype = new LineChartRasterizer(false);
        IFrameRasterizer<ChartFrame> copy = prototype.createThreadInstance();
        QualityProfile profile = profile(1.0, ColorEncoding.fullColor());

        BufferedImage a = prototype.rasterize(chart.frames().get(2), profile);
        BufferedImage b = copy.rasterize(chart.frames().get(2), profile);

        assertThat(copy).isNotSameAs(prototype);
        assertThat(b.getRGB(0, 0, 200, 150, null, 0, 200)).isEqualTo(a.getRGB(0, 0, 200, 150, null, 0, 200));
    }

    @Test
    void rowIndexLabelsAreDrawnUnderTheAxis() throws Exception {
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("altitude", new double[]{0, 4, 9, 3, 7, 10});
        SeriesTable indexed = new SeriesTable(columns, Map.of("altitude", true), "time",
            List.of("08:00", "08:01", "08:02", "08:03", "08:04", "08:05"));
        SeriesTable numbered = new SeriesTable(columns, Map.of("altitude", true));
        QualityProfile profile = profile(1.0, ColorEncoding.fullColor());

        BufferedImage withIndex = new LineChartRasterizer()
            .rasterize(new TimeSeriesChart(indexed, List.of("altitude"), "").frames().get(5), profile);
        BufferedImage withRowNumbers = new LineChartRasterizer()
            .rasterize(new TimeSeriesChart(numbered, List.of("altitude"), "").frames().get(5), profile);

        // plot area is identical, only the strip under the x axis differs
        int[] top = withIndex.getRGB(0, 0, 200, 100, null, 0, 200);
        assertThat(withRowNumbers.getRGB(0, 0, 200, 100, null, 0, 200)).isEqualTo(top);
        assertThat(withRowNumbers.getRGB(0, 100, 200, 50, null, 0, 200))
            .isNotEqualTo(withIndex.getRGB(0, 100, 200, 50, null, 0, 200));
    }

    @Test
    void invalidFrameFails() {
        ChartFrame broken = new ChartFrame(chart, 0, 99);

        assertThatThrownBy(() -> new LineChartRasterizer().rasterize(broken, profile(1.0, ColorEncoding.fullColor())))
            .isInstanceOf(FrameRenderException.class);
        assertThatThrownBy(() -> new LineChartRasterizer().rasterize(null, profile(1.0, ColorEncoding.fullColor())))
            .isInstanceOf(FrameRenderException.class);
    }

    private static QualityProfile profile(double scale, ColorEncoding encoding) {
        return new QualityProfile("test", "Test", 200, 150, scale, OptionalInt.empty(),
            new FrameStepPolicy.Threshold(10), 100, encoding);
    }
}
