package org.flightplot.export.gif;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;

import org.flightplot.export.AnimatedArtifact;
import org.flightplot.export.ColorEncoding;
import org.flightplot.export.EncodingException;
import org.flightplot.export.IAnimationEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes frames as an infinitely looping GIF89a using the JDK ImageIO GIF writer.
 * <p>
 * Output:
 * <ul>
 *   <li>NETSCAPE2.0 application extension with loop count 0 (loop forever) on the first frame</li>
 *   <li>Graphic Control Extension per frame with the frame delay in centiseconds</li>
 *   <li><strong>Reduced palette:</strong> every frame quantized on its own to the palette size,
 *       disposal {@code restoreToBackgroundColor} so no frame is composited over the previous one</li>
 *   <li><strong>Full color:</strong> the first frame is written whole, every later frame is cropped
 *       to the rectangle that changed since its predecessor and written at that offset with
 *       disposal {@code doNotDispose}; the writer builds a 256-color table per frame</li>
 * </ul>
 */
public class GifAnimationEncoder implements IAnimationEncoder {

    private static final Logger log = LoggerFactory.getLogger(GifAnimationEncoder.class);

    public static final String MIME_TYPE = "image/gif";

    static final String DISPOSE_RESTORE_BACKGROUND = "restoreToBackgroundColor";
    static final String DISPOSE_NONE = "doNotDispose";

    @Override
    public AnimatedArtifact encode(List<BufferedImage> frames, int perFrameDurationMs, ColorEncoding encoding)
            throws EncodingException {
        validate(frames);
        int width = frames.get(0).getWidth();
        int height = frames.get(0).getHeight();
        int delayCs = Math.max(1, perFrameDurationMs / 10);

        ImageWriter writer = gifWriter();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(buffer)) {
            writer.setOutput(output);
            ImageWriteParam param = writer.getDefaultWriteParam();
            writer.prepareWriteSequence(null);

            BufferedImage previous = null;
            for (int i = 0; i < frames.size(); i++) {
                BufferedImage frame = frames.get(i);
                if (encoding.isReducedPalette()) {
                    BufferedImage indexed = toPalette(frame, encoding.colors());
                    writeFrame(writer, param, indexed, 0, 0, delayCs, DISPOSE_RESTORE_BACKGROUND, i == 0);
                } else if (previous == null) {
                    writeFrame(writer, param, toRgb(frame), 0, 0, delayCs, DISPOSE_NONE, true);
                } else {
                    Patch patch = changedRegion(previous, frame);
                    writeFrame(writer, param, patch.image(), patch.x(), patch.y(), delayCs, DISPOSE_NONE, false);
                }
                previous = frame;
            }

            writer.endWriteSequence();
        } catch (IOException | RuntimeException e) {
            throw new EncodingException("GIF encoding failed: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }

        byte[] bytes = buffer.toByteArray();
        log.debug("Encoded {} frame(s) at {}x{} ({}, {} cs/frame): {} bytes",
            frames.size(), width, height, encoding, delayCs, bytes.length);
        return new AnimatedArtifact(bytes, MIME_TYPE, frames.size(), width, height);
    }

    private static void validate(List<BufferedImage> frames) throws EncodingException {
        if (frames == null || frames.isEmpty()) {
            throw new EncodingException("No frames to encode");
        }
        BufferedImage first = frames.get(0);
        if (first == null) {
            throw new EncodingException("Frame 0 is missing");
        }
        for (int i = 1; i < frames.size(); i++) {
            BufferedImage frame = frames.get(i);
            if (frame == null) {
                throw new EncodingException("Frame " + i + " is missing");
            }
            if (frame.getWidth() != first.getWidth() || frame.getHeight() != first.getHeight()) {
                throw new EncodingException(String.format(
                    "Inconsistent frame dimensions: frame 0 is %dx%d, frame %d is %dx%d",
                    first.getWidth(), first.getHeight(), i, frame.getWidth(), frame.getHeight()));
            }
        }
    }

    private static ImageWriter gifWriter() throws EncodingException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("gif");
        if (!writers.hasNext()) {
            throw new EncodingException("No GIF writer found");
        }
        return writers.next();
    }

    private static void writeFrame(ImageWriter writer, ImageWriteParam param, BufferedImage image,
                                   int x, int y, int delayCs, String disposal, boolean first) throws IOException {
        ImageTypeSpecifier type = ImageTypeSpecifier.createFromRenderedImage(image);
        IIOMetadata metadata = writer.getDefaultImageMetadata(type, param);
        String format = metadata.getNativeMetadataFormatName();
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(format);

        IIOMetadataNode control = getOrCreateNode(root, "GraphicControlExtension");
        control.setAttribute("disposalMethod", disposal);
        control.setAttribute("userInputFlag", "FALSE");
        control.setAttribute("transparentColorFlag", "FALSE");
        control.setAttribute("delayTime", Integer.toString(delayCs));
        control.setAttribute("transparentColorIndex", "0");

        IIOMetadataNode descriptor = getOrCreateNode(root, "ImageDescriptor");
        descriptor.setAttribute("imageLeftPosition", Integer.toString(x));
        descriptor.setAttribute("imageTopPosition", Integer.toString(y));
        descriptor.setAttribute("imageWidth", Integer.toString(image.getWidth()));
        descriptor.setAttribute("imageHeight", Integer.toString(image.getHeight()));
        descriptor.setAttribute("interlaceFlag", "FALSE");

        if (first) {
            IIOMetadataNode extensions = getOrCreateNode(root, "ApplicationExtensions");
            IIOMetadataNode loop = new IIOMetadataNode("ApplicationExtension");
            loop.setAttribute("applicationID", "NETSCAPE");
            loop.setAttribute("authenticationCode", "2.0");
            // Sub-block 1, loop count 0 (little-endian): loop forever
            loop.setUserObject(new byte[]{1, 0, 0});
            extensions.appendChild(loop);
        }

        metadata.setFromTree(format, root);
        writer.writeToSequence(new IIOImage(image, null, metadata), param);
    }

    private static IIOMetadataNode getOrCreateNode(IIOMetadataNode root, String nodeName) {
        for (int i = 0; i < root.getLength(); i++) {
            if (root.item(i).getNodeName().equals(nodeName)) {
                return (IIOMetadataNode) root.item(i);
            }
        }
        IIOMetadataNode node = new IIOMetadataNode(nodeName);
        root.appendChild(node);
        return node;
    }

    private static BufferedImage toPalette(BufferedImage frame, int colors) {
        if (frame.getType() == BufferedImage.TYPE_BYTE_INDEXED
                && frame.getColorModel() instanceof IndexColorModel icm
                && icm.getMapSize() <= colors) {
            return frame;
        }
        return MedianCutQuantizer.quantize(frame, colors);
    }

    private static BufferedImage toRgb(BufferedImage frame) {
        if (frame.getType() == BufferedImage.TYPE_INT_RGB) {
            return frame;
        }
        BufferedImage rgb = new BufferedImage(frame.getWidth(), frame.getHeight(), BufferedImage.TYPE_INT_RGB);
        rgb.setRGB(0, 0, frame.getWidth(), frame.getHeight(),
            frame.getRGB(0, 0, frame.getWidth(), frame.getHeight(), null, 0, frame.getWidth()), 0, frame.getWidth());
        return rgb;
    }

    /**
     * Sub-image of a frame placed at an offset of the logical screen.
     */
    record Patch(BufferedImage image, int x, int y) {
    }

    /**
     * Crops {@code current} to the bounding box of pixels that differ from {@code previous}.
     * An unchanged frame becomes a 1x1 patch so its delay is still played.
     */
    static Patch changedRegion(BufferedImage previous, BufferedImage current) {
        int width = current.getWidth();
        int height = current.getHeight();
        int[] before = previous.getRGB(0, 0, width, height, null, 0, width);
        int[] after = current.getRGB(0, 0, width, height, null, 0, width);

        int minX = width;
        int minY = height;
        int maxX = -1;
        int maxY = -1;
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                if (before[row + x] != after[row + x]) {
                    if (x < minX) minX = x;
                    if (x > maxX) maxX = x;
                    if (y < minY) minY = y;
                    if (y > maxY) maxY = y;
                }
            }
        }
        if (maxX < 0) {
            minX = 0;
            minY = 0;
            maxX = 0;
            maxY = 0;
        }

        int patchWidth = maxX - minX + 1;
        int patchHeight = maxY - minY + 1;
        BufferedImage patch = new BufferedImage(patchWidth, patchHeight, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < patchHeight; y++) {
            patch.setRGB(0, y, patchWidth, 1, after, (minY + y) * width + minX, width);
        }
        return new Patch(patch, minX, minY);
    }
}
