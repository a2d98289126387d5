package org.qemu4j.display;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Framebuffer backed by a packed R, G, B byte array. All methods are synchronized so an
 * export never observes a half-applied rectangle.
 */
public class RgbFramebuffer implements Framebuffer {

    private int width;
    private int height;
    private byte[] pixels;
    private long version;

    public RgbFramebuffer(int width, int height) {
        checkSize(width, height);
        this.width = width;
        this.height = height;
        this.pixels = new byte[width * height * CHANNELS];
    }

    @Override
    public synchronized int getWidth() {
        return width;
    }

    @Override
    public synchronized int getHeight() {
        return height;
    }

    @Override
    public synchronized int getPixel(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            return 0;
        }
        int i = (y * width + x) * CHANNELS;
        return (pixels[i] & 0xFF) << 16 | (pixels[i + 1] & 0xFF) << 8 | (pixels[i + 2] & 0xFF);
    }

    @Override
    public synchronized void resize(int newWidth, int newHeight) {
        checkSize(newWidth, newHeight);
        this.width = newWidth;
        this.height = newHeight;
        this.pixels = new byte[newWidth * newHeight * CHANNELS];
        version++;
    }

    @Override
    public synchronized boolean ensureSize(int minWidth, int minHeight) {
        if (minWidth <= width && minHeight <= height) {
            return false;
        }
        int newWidth = Math.max(width, minWidth);
        int newHeight = Math.max(height, minHeight);
        checkSize(newWidth, newHeight);
        byte[] grown = new byte[newWidth * newHeight * CHANNELS];
        int rowBytes = width * CHANNELS;
        for (int row = 0; row < height; row++) {
            System.arraycopy(pixels, row * rowBytes, grown, row * newWidth * CHANNELS, rowBytes);
        }
        this.pixels = grown;
        this.width = newWidth;
        this.height = newHeight;
        version++;
        return true;
    }

    @Override
    public synchronized void blit(int x, int y, int w, int h, byte[] src, int offset, PixelFormat format) {
        if (w <= 0 || h <= 0) {
            return;
        }
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Rectangle origin must not be negative: " + x + "," + y);
        }
        int bpp = format.bytesPerPixel();
        if (src.length - offset < w * h * bpp) {
            throw new IllegalArgumentException("Pixel data too short for " + w + "x" + h + " rectangle");
        }
        ensureSize(x + w, y + h);
        int in = offset;
        for (int row = 0; row < h; row++) {
            int out = ((y + row) * width + x) * CHANNELS;
            for (int col = 0; col < w; col++) {
                int rgb = format.toRgb(src, in);
                pixels[out] = (byte) (rgb >> 16);
                pixels[out + 1] = (byte) (rgb >> 8);
                pixels[out + 2] = (byte) rgb;
                in += bpp;
                out += CHANNELS;
            }
        }
        version++;
    }

    @Override
    public synchronized byte[] toRgbBytes() {
        return Arrays.copyOf(pixels, pixels.length);
    }

    @Override
    public synchronized BufferedImage toImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            int i = y * width * CHANNELS;
            for (int x = 0; x < width; x++) {
                row[x] = (pixels[i] & 0xFF) << 16 | (pixels[i + 1] & 0xFF) << 8 | (pixels[i + 2] & 0xFF);
                i += CHANNELS;
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    @Override
    public synchronized long getVersion() {
        return version;
    }

    private static void checkSize(int width, int height) {
        if (width <= 0 || height <= 0 || (long) width * height * CHANNELS > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Invalid framebuffer size " + width + "x" + height);
        }
    }
}
