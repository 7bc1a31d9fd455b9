package org.flightplot.export;

import java.util.Locale;

/**
 * An encoded animation, ready for download.
 * <p>
 * Immutable: the bytes are copied on the way in and on the way out.
 */
public final class AnimatedArtifact {

    private final byte[] bytes;
    private final String mimeType;
    private final int frameCount;
    private final int width;
    private final int height;

    public AnimatedArtifact(byte[] bytes, String mimeType, int frameCount, int width, int height) {
        this.bytes = bytes.clone();
        this.mimeType = mimeType;
        this.frameCount = frameCount;
        this.width = width;
        this.height = height;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int byteSize() {
        return bytes.length;
    }

    public String mimeType() {
        return mimeType;
    }

    public int frameCount() {
        return frameCount;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * Formats the byte size for display, e.g. {@code 12.3 KB}.
     *
     * @return human-readable size.
     */
    public String formattedSize() {
        if (bytes.length < 1024) {
            return bytes.length + " B";
        }
        if (bytes.length < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f KB", bytes.length / 1024.0);
        }
        return String.format(Locale.ROOT, "%.1f MB", bytes.length / (1024.0 * 1024.0));
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "AnimatedArtifact[%s, %dx%d, %d frames, %s]",
            mimeType, width, height, frameCount, formattedSize());
    }
}
