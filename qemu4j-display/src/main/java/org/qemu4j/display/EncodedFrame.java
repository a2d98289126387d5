package org.qemu4j.display;

import java.time.Instant;
import java.util.Objects;

/**
 * One compressed frame (JPEG) with its capture sequence number and time.
 */
public final class EncodedFrame {

    private final byte[] data;
    private final long sequence;
    private final Instant capturedAt;
    private final int width;
    private final int height;

    public EncodedFrame(byte[] data, long sequence, Instant capturedAt, int width, int height) {
        this.data = Objects.requireNonNull(data, "data").clone();
        this.sequence = sequence;
        this.capturedAt = Objects.requireNonNull(capturedAt, "capturedAt");
        this.width = width;
        this.height = height;
    }

    /**
     * Returns a copy of the encoded image bytes.
     */
    public byte[] getData() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getCapturedAt() {
        return capturedAt;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }
}
