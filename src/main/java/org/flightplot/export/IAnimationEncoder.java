package org.flightplot.export;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Assembles ordered frames into one looping animation.
 */
public interface IAnimationEncoder {

    /**
     * Encodes frames in the given order.
     *
     * @param frames             non-empty frames of identical size.
     * @param perFrameDurationMs display time of each frame.
     * @param encoding           palette reduction or full color.
     * @return the encoded animation.
     * @throws EncodingException if the frames are rejected or cannot be written.
     */
    AnimatedArtifact encode(List<BufferedImage> frames, int perFrameDurationMs, ColorEncoding encoding)
            throws EncodingException;
}
