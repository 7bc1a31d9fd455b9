package org.flightplot.export.gif;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.awt.image.IndexColorModel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Reduces an image to a small adaptive palette using median cut.
 * <p>
 * Colors are first bucketed at 5 bits per channel. The color box with the widest channel
 * range is repeatedly split at the population median of that channel until the requested
 * palette size is reached or no box can be split. Each palette entry is the
 * population-weighted mean of its box, and every pixel maps to its nearest entry.
 * <p>
 * The result is a {@link BufferedImage#TYPE_BYTE_INDEXED} image whose color model has at
 * most the requested number of entries (and at least two, as GIF requires).
 */
public final class MedianCutQuantizer {

    private static final int BITS = 5;
    private static final int LEVELS = 1 << BITS;
    private static final int SHIFT = 8 - BITS;

    private MedianCutQuantizer() {
    }

    /**
     * Quantizes an image.
     *
     * @param image  source image, any type.
     * @param colors maximum palette size, 2 to 256.
     * @return a new indexed image of the same size.
     */
    public static BufferedImage quantize(BufferedImage image, int colors) {
        if (colors < 2 || colors > 256) {
            throw new IllegalArgumentException("Palette size must be between 2 and 256, got " + colors);
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);

        int[] histogram = new int[LEVELS * LEVELS * LEVELS];
        long[][] sums = new long[3][histogram.length];
        for (int pixel : argb) {
            int k = key(pixel);
            histogram[k]++;
            sums[0][k] += pixel >> 16 & 0xFF;
            sums[1][k] += pixel >> 8 & 0xFF;
            sums[2][k] += pixel & 0xFF;
        }

        int[] palette = buildPalette(histogram, sums, colors);
        IndexColorModel colorModel = toColorModel(palette);

        int[] lookup = new int[histogram.length];
        Arrays.fill(lookup, -1);
        BufferedImage indexed = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_INDEXED, colorModel);
        byte[] target = ((DataBufferByte) indexed.getRaster().getDataBuffer()).getData();
        for (int i = 0; i < argb.length; i++) {
            int k = key(argb[i]);
            int index = lookup[k];
            if (index < 0) {
                index = nearest(palette, argb[i]);
                lookup[k] = index;
            }
            target[i] = (byte) index;
        }
        return indexed;
    }

    private static int key(int pixel) {
        int r = (pixel >> 16 & 0xFF) >> SHIFT;
        int g = (pixel >> 8 & 0xFF) >> SHIFT;
        int b = (pixel & 0xFF) >> SHIFT;
        return (r << (2 * BITS)) | (g << BITS) | b;
    }

    private static int[] buildPalette(int[] histogram, long[][] sums, int colors) {
        List<Integer> occupied = new ArrayList<>();
        for (int k = 0; k < histogram.length; k++) {
            if (histogram[k] > 0) {
                occupied.add(k);
            }
        }

        List<Box> boxes = new ArrayList<>();
        boxes.add(new Box(occupied));
        while (boxes.size() < colors) {
            Box widest = boxes.stream()
                .filter(Box::splittable)
                .max(Comparator.comparingInt(Box::widestRange))
                .orElse(null);
            if (widest == null) {
                break;
            }
            boxes.remove(widest);
            boxes.addAll(widest.split(histogram));
        }

        int size = Math.max(2, boxes.size());
        int[] palette = new int[size];
        for (int i = 0; i < boxes.size(); i++) {
            palette[i] = boxes.get(i).meanColor(histogram, sums);
        }
        if (boxes.size() == 1) {
            palette[1] = palette[0];
        }
        return palette;
    }

    private static IndexColorModel toColorModel(int[] palette) {
        byte[] r = new byte[palette.length];
        byte[] g = new byte[palette.length];
        byte[] b = new byte[palette.length];
        for (int i = 0; i < palette.length; i++) {
            r[i] = (byte) (palette[i] >> 16);
            g[i] = (byte) (palette[i] >> 8);
            b[i] = (byte) palette[i];
        }
        return new IndexColorModel(8, palette.length, r, g, b);
    }

    private static int nearest(int[] palette, int pixel) {
        int r = pixel >> 16 & 0xFF;
        int g = pixel >> 8 & 0xFF;
        int b = pixel & 0xFF;
        int best = 0;
        int bestDistance = Integer.MAX_VALUE;
        for (int i = 0; i < palette.length; i++) {
            int dr = r - (palette[i] >> 16 & 0xFF);
            int dg = g - (palette[i] >> 8 & 0xFF);
            int db = b - (palette[i] & 0xFF);
            int distance = dr * dr + dg * dg + db * db;
            if (distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }

    private static int channel(int key, int channel) {
        return (key >> (BITS * (2 - channel))) & (LEVELS - 1);
    }

    /**
     * A set of occupied histogram keys.
     */
    private static final class Box {

        private final List<Integer> keys;
        private final int[] min = new int[3];
        private final int[] max = new int[3];

        Box(List<Integer> keys) {
            this.keys = keys;
            Arrays.fill(min, LEVELS);
            Arrays.fill(max, -1);
            for (int key : keys) {
                for (int c = 0; c < 3; c++) {
                    int v = channel(key, c);
                    min[c] = Math.min(min[c], v);
                    max[c] = Math.max(max[c], v);
                }
            }
        }

        boolean splittable() {
            return keys.size() > 1;
        }

        int widestChannel() {
            int widest = 0;
            for (int c = 1; c < 3; c++) {
                if (max[c] - min[c] > max[widest] - min[widest]) {
                    widest = c;
                }
            }
            return widest;
        }

        int widestRange() {
            int c = widestChannel();
            return max[c] - min[c];
        }

        List<Box> split(int[] histogram) {
            int c = widestChannel();
            List<Integer> sorted = new ArrayList<>(keys);
            sorted.sort(Comparator.comparingInt(k -> channel(k, c)));

            long population = 0;
            for (int key : sorted) {
                population += histogram[key];
            }
            long half = population / 2;
            long running = 0;
            int cut = 1;
            for (int i = 0; i < sorted.size() - 1; i++) {
                running += histogram[sorted.get(i)];
                cut = i + 1;
                if (running >= half) {
                    break;
                }
            }
            return List.of(new Box(new ArrayList<>(sorted.subList(0, cut))),
                new Box(new ArrayList<>(sorted.subList(cut, sorted.size()))));
        }

        int meanColor(int[] histogram, long[][] sums) {
            long r = 0;
            long g = 0;
            long b = 0;
            long n = 0;
            for (int key : keys) {
                r += sums[0][key];
                g += sums[1][key];
                b += sums[2][key];
                n += histogram[key];
            }
            if (n == 0) {
                return 0;
            }
            return (int) (r / n) << 16 | (int) (g / n) << 8 | (int) (b / n);
        }
    }
}
