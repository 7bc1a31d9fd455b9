package org.flightplot.export;

/**
 * Color encoding strategy of a quality profile.
 * <p>
 * {@link Mode#REDUCED_PALETTE} frames are quantized to at most {@link #colors()}
 * colors and encoded with a discard-previous-frame disposal policy.
 * {@link Mode#FULL_COLOR} frames keep 24-bit color until the encoder builds its
 * own palette.
 *
 * @param mode   the encoding mode
 * @param colors palette size for reduced-palette encoding, 0 for full color
 */
public record ColorEncoding(Mode mode, int colors) {

    /** Smallest palette the GIF format can describe. */
    public static final int MIN_PALETTE_SIZE = 2;
    /** Largest palette the GIF format can describe. */
    public static final int MAX_PALETTE_SIZE = 256;

    public enum Mode {
        REDUCED_PALETTE,
        FULL_COLOR
    }

    public ColorEncoding {
        if (mode == Mode.REDUCED_PALETTE && (colors < MIN_PALETTE_SIZE || colors > MAX_PALETTE_SIZE)) {
            throw new IllegalArgumentException("Palette size must be between "
                + MIN_PALETTE_SIZE + " and " + MAX_PALETTE_SIZE + ", got " + colors);
        }
        if (mode == Mode.FULL_COLOR) {
            colors = 0;
        }
    }

    public static ColorEncoding reducedPalette(int colors) {
        return new ColorEncoding(Mode.REDUCED_PALETTE, colors);
    }

    public static ColorEncoding fullColor() {
        return new ColorEncoding(Mode.FULL_COLOR, 0);
    }

    public boolean isReducedPalette() {
        return mode == Mode.REDUCED_PALETTE;
    }

    @Override
    public String toString() {
        return isReducedPalette() ? "ReducedPalette(" + colors + ")" : "FullColor";
    }
}
