package org.qemu4j.display;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Compresses framebuffer snapshots to JPEG, scaling to a fixed output resolution when the
 * framebuffer's native size differs.
 */
public final class FrameEncoder {

    public static final float DEFAULT_QUALITY = 0.8f;

    private final int targetWidth;
    private final int targetHeight;
    private final float quality;

    /**
     * @param targetWidth  output width; 0 keeps the native width
     * @param targetHeight output height; 0 keeps the native height
     * @param quality      JPEG quality in [0, 1]
     */
    public FrameEncoder(int targetWidth, int targetHeight, float quality) {
        if (targetWidth < 0 || targetHeight < 0) {
            throw new IllegalArgumentException("Target size must not be negative");
        }
        if (quality < 0f || quality > 1f) {
            throw new IllegalArgumentException("JPEG quality must be in [0, 1], got " + quality);
        }
        this.targetWidth = targetWidth;
        this.targetHeight = targetHeight;
        this.quality = quality;
    }

    public FrameEncoder(int targetWidth, int targetHeight) {
        this(targetWidth, targetHeight, DEFAULT_QUALITY);
    }

    public byte[] encode(BufferedImage image) throws IOException {
        BufferedImage scaled = scale(image);
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(1024, scaled.getWidth() * scaled.getHeight() / 4));
        try (ImageOutputStream ios = new MemoryCacheImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.setOutput(ios);
            writer.write(null, new IIOImage(scaled, null, null), param);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    /**
     * Output width for a framebuffer of the given native width.
     */
    public int outputWidth(int nativeWidth) {
        return targetWidth > 0 ? targetWidth : nativeWidth;
    }

    public int outputHeight(int nativeHeight) {
        return targetHeight > 0 ? targetHeight : nativeHeight;
    }

    BufferedImage scale(BufferedImage image) {
        int w = outputWidth(image.getWidth());
        int h = outputHeight(image.getHeight());
        if (w == image.getWidth() && h == image.getHeight()) {
            return image;
        }
        BufferedImage scaled = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, w, h, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }
}
