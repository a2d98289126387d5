package org.qemu4j.display;

import java.awt.image.BufferedImage;

/**
 * Client-side copy of the remote screen: width x height RGB pixels, updated in place by
 * rectangle updates and read through copies.
 */
public interface Framebuffer {

    int CHANNELS = 3;

    int getWidth();

    int getHeight();

    /**
     * Pixel at (x, y) as 0xRRGGBB; 0 outside the buffer.
     */
    int getPixel(int x, int y);

    /**
     * Reallocate to a new size with all pixels black (remote desktop resize).
     */
    void resize(int width, int height);

    /**
     * Grow to at least the given size, keeping existing pixels. No-op if already large enough.
     *
     * @return true if the buffer grew
     */
    boolean ensureSize(int width, int height);

    /**
     * Copy a rectangle of wire-format pixels into the buffer, converting each pixel from
     * {@code format} to RGB. Grows the buffer first if the rectangle does not fit.
     *
     * @param pixels {@code w * h * format.bytesPerPixel()} bytes starting at {@code offset}, row-major
     */
    void blit(int x, int y, int w, int h, byte[] pixels, int offset, PixelFormat format);

    /**
     * Copy of the pixel store, {@code width * height * CHANNELS} bytes in R, G, B order.
     */
    byte[] toRgbBytes();

    /**
     * Copy of the current contents as an RGB image.
     */
    BufferedImage toImage();

    /**
     * Counter incremented on every mutation, used to tell whether anything changed
     * since the last export.
     */
    long getVersion();
}
