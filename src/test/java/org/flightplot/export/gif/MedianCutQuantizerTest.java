package org.flightplot.export.gif;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MedianCutQuantizer}.
 */
@Tag("unit")
class MedianCutQuantizerTest {

    @Test
    @DisplayName("A gradient is reduced to at most the requested palette size")
    void gradientIsReduced() {
        BufferedImage gradient = new BufferedImage(64, 64, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 64; y++) {
            for (int x = 0; x < 64; x++) {
                gradient.setRGB(x, y, new Color(x * 4, y * 4, (x + y) * 2).getRGB());
            }
        }
        assertThat(TestImages.countColors(gradient)).isGreaterThan(16);

        BufferedImage indexed = MedianCutQuantizer.quantize(gradient, 16);

        assertThat(indexed.getType()).isEqualTo(BufferedImage.TYPE_BYTE_INDEXED);
        assertThat(((IndexColorModel) indexed.getColorModel()).getMapSize()).isLessThanOrEqualTo(16);
        assertThat(TestImages.countColors(indexed)).isLessThanOrEqualTo(16);
        assertThat(indexed.getWidth()).isEqualTo(64);
        assertThat(indexed.getHeight()).isEqualTo(64);
    }

    @Test
    @DisplayName("Images with few colors keep them exactly")
    void fewColorsArePreserved() {
        BufferedImage image = new BufferedImage(20, 10, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 20, 10);
        g.setColor(new Color(0xE41A1C));
        g.fillRect(0, 0, 10, 5);
        g.setColor(new Color(0x377EB8));
        g.fillRect(10, 5, 10, 5);
        g.dispose();

        BufferedImage indexed = MedianCutQuantizer.quantize(image, 16);

        assertThat(indexed.getRGB(15, 1) & 0xFFFFFF).isEqualTo(0xFFFFFF);
        assertThat(indexed.getRGB(2, 2) & 0xFFFFFF).isEqualTo(0xE41A1C);
        assertThat(indexed.getRGB(12, 7) & 0xFFFFFF).isEqualTo(0x377EB8);
    }

    @Test
    @DisplayName("A single-color image still gets a two-entry palette")
    void singleColorImage() {
        BufferedImage image = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);

        BufferedImage indexed = MedianCutQuantizer.quantize(image, 8);

        assertThat(((IndexColorModel) indexed.getColorModel()).getMapSize()).isEqualTo(2);
        assertThat(indexed.getRGB(0, 0) & 0xFFFFFF).isZero();
    }

    @Test
    void rejectsInvalidPaletteSize() {
        BufferedImage image = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);

        assertThatThrownBy(() -> MedianCutQuantizer.quantize(image, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MedianCutQuantizer.quantize(image, 257)).isInstanceOf(IllegalArgumentException.class);
    }
}
