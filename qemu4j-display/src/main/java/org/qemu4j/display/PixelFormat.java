package org.qemu4j.display;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * RFB pixel format: how a pixel value is laid out on the wire.
 * <p>
 * Wire layout (16 bytes, big-endian):
 * <pre>
 *   [1B] bits-per-pixel   [1B] depth   [1B] big-endian flag   [1B] true-colour flag
 *   [2B] red-max   [2B] green-max   [2B] blue-max
 *   [1B] red-shift [1B] green-shift [1B] blue-shift   [3B] padding
 * </pre>
 */
public final class PixelFormat {

    public static final int WIRE_LENGTH = 16;

    /**
     * The format the client always asks for: 32 bpp little-endian true-colour with
     * red in bits 16-23, green 8-15, blue 0-7 (B, G, R, X byte order on the wire).
     */
    public static final PixelFormat PREFERRED = new PixelFormat(32, 24, false, true, 255, 255, 255, 16, 8, 0);

    private final int bitsPerPixel;
    private final int depth;
    private final boolean bigEndian;
    private final boolean trueColor;
    private final int redMax;
    private final int greenMax;
    private final int blueMax;
    private final int redShift;
    private final int greenShift;
    private final int blueShift;

    public PixelFormat(int bitsPerPixel, int depth, boolean bigEndian, boolean trueColor,
                       int redMax, int greenMax, int blueMax,
                       int redShift, int greenShift, int blueShift) {
        if (bitsPerPixel != 8 && bitsPerPixel != 16 && bitsPerPixel != 32) {
            throw new IllegalArgumentException("bits-per-pixel must be 8, 16 or 32, got " + bitsPerPixel);
        }
        this.bitsPerPixel = bitsPerPixel;
        this.depth = depth;
        this.bigEndian = bigEndian;
        this.trueColor = trueColor;
        this.redMax = redMax;
        this.greenMax = greenMax;
        this.blueMax = blueMax;
        this.redShift = redShift;
        this.greenShift = greenShift;
        this.blueShift = blueShift;
    }

    /**
     * Decode the 16-byte wire record at the buffer's current position.
     */
    public static PixelFormat read(ByteBuffer buf) {
        ByteBuffer b = buf.order(ByteOrder.BIG_ENDIAN);
        int bpp = b.get() & 0xFF;
        int depth = b.get() & 0xFF;
        boolean bigEndian = b.get() != 0;
        boolean trueColor = b.get() != 0;
        int rMax = b.getShort() & 0xFFFF;
        int gMax = b.getShort() & 0xFFFF;
        int bMax = b.getShort() & 0xFFFF;
        int rShift = b.get() & 0xFF;
        int gShift = b.get() & 0xFF;
        int bShift = b.get() & 0xFF;
        b.position(b.position() + 3);
        return new PixelFormat(bpp, depth, bigEndian, trueColor, rMax, gMax, bMax, rShift, gShift, bShift);
    }

    public static PixelFormat fromBytes(byte[] wire) {
        if (wire == null || wire.length < WIRE_LENGTH) {
            throw new IllegalArgumentException("Pixel format record must be " + WIRE_LENGTH + " bytes");
        }
        return read(ByteBuffer.wrap(wire));
    }

    /**
     * Encode as the 16-byte wire record at the buffer's current position.
     */
    public void write(ByteBuffer buf) {
        ByteBuffer b = buf.order(ByteOrder.BIG_ENDIAN);
        b.put((byte) bitsPerPixel);
        b.put((byte) depth);
        b.put((byte) (bigEndian ? 1 : 0));
        b.put((byte) (trueColor ? 1 : 0));
        b.putShort((short) redMax);
        b.putShort((short) greenMax);
        b.putShort((short) blueMax);
        b.put((byte) redShift);
        b.put((byte) greenShift);
        b.put((byte) blueShift);
        b.put(new byte[3]);
    }

    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(WIRE_LENGTH);
        write(buf);
        return buf.array();
    }

    /**
     * Convert one pixel at {@code offset} to 0xRRGGBB. Channels with a max other than 255
     * are scaled to the 0-255 range.
     */
    public int toRgb(byte[] src, int offset) {
        int value = readPixel(src, offset);
        int r = scale((value >>> redShift) & redMax, redMax);
        int g = scale((value >>> greenShift) & greenMax, greenMax);
        int b = scale((value >>> blueShift) & blueMax, blueMax);
        return (r << 16) | (g << 8) | b;
    }

    /**
     * Encode 0xRRGGBB as a pixel in this format, written at {@code offset}.
     */
    public void fromRgb(int rgb, byte[] dst, int offset) {
        int r = ((rgb >> 16) & 0xFF) * redMax / 255;
        int g = ((rgb >> 8) & 0xFF) * greenMax / 255;
        int b = (rgb & 0xFF) * blueMax / 255;
        int value = (r << redShift) | (g << greenShift) | (b << blueShift);
        int n = bytesPerPixel();
        for (int i = 0; i < n; i++) {
            int shift = bigEndian ? (n - 1 - i) * 8 : i * 8;
            dst[offset + i] = (byte) (value >>> shift);
        }
    }

    private int readPixel(byte[] src, int offset) {
        switch (bitsPerPixel) {
            case 8:
                return src[offset] & 0xFF;
            case 16:
                return bigEndian
                        ? (src[offset] & 0xFF) << 8 | (src[offset + 1] & 0xFF)
                        : (src[offset + 1] & 0xFF) << 8 | (src[offset] & 0xFF);
            default:
                return bigEndian
                        ? (src[offset] & 0xFF) << 24 | (src[offset + 1] & 0xFF) << 16
                        | (src[offset + 2] & 0xFF) << 8 | (src[offset + 3] & 0xFF)
                        : (src[offset + 3] & 0xFF) << 24 | (src[offset + 2] & 0xFF) << 16
                        | (src[offset + 1] & 0xFF) << 8 | (src[offset] & 0xFF);
        }
    }

    private static int scale(int value, int max) {
        if (max == 255 || max == 0) {
            return value & 0xFF;
        }
        return (value * 255 + max / 2) / max;
    }

    public int bytesPerPixel() {
        return bitsPerPixel / 8;
    }

    public int getBitsPerPixel() {
        return bitsPerPixel;
    }

    public int getDepth() {
        return depth;
    }

    public boolean isBigEndian() {
        return bigEndian;
    }

    public boolean isTrueColor() {
        return trueColor;
    }

    public int getRedMax() {
        return redMax;
    }

    public int getGreenMax() {
        return greenMax;
    }

    public int getBlueMax() {
        return blueMax;
    }

    public int getRedShift() {
        return redShift;
    }

    public int getGreenShift() {
        return greenShift;
    }

    public int getBlueShift() {
        return blueShift;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelFormat)) return false;
        PixelFormat that = (PixelFormat) o;
        return bitsPerPixel == that.bitsPerPixel && depth == that.depth && bigEndian == that.bigEndian
                && trueColor == that.trueColor && redMax == that.redMax && greenMax == that.greenMax
                && blueMax == that.blueMax && redShift == that.redShift && greenShift == that.greenShift
                && blueShift == that.blueShift;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bitsPerPixel, depth, bigEndian, trueColor, redMax, greenMax, blueMax,
                redShift, greenShift, blueShift);
    }

    @Override
    public String toString() {
        return bitsPerPixel + "bpp depth=" + depth + (bigEndian ? " BE" : " LE")
                + (trueColor ? " true-colour" : " palette")
                + " max=" + redMax + "/" + greenMax + "/" + blueMax
                + " shift=" + redShift + "/" + greenShift + "/" + blueShift;
    }
}
