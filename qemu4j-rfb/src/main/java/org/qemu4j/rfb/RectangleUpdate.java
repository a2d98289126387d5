package org.qemu4j.rfb;

import java.io.DataInput;
import java.io.IOException;

/**
 * Header of one rectangle inside a FramebufferUpdate message. The payload that follows
 * depends on {@link #encoding()} and is consumed by the caller.
 * <pre>
 *   [2B] x   [2B] y   [2B] width   [2B] height   [4B] encoding (signed)
 * </pre>
 */
public record RectangleUpdate(int x, int y, int width, int height, int encoding) {

    public static final int HEADER_LENGTH = 12;

    public static RectangleUpdate read(DataInput in) throws IOException {
        int x = in.readUnsignedShort();
        int y = in.readUnsignedShort();
        int w = in.readUnsignedShort();
        int h = in.readUnsignedShort();
        int encoding = in.readInt();
        return new RectangleUpdate(x, y, w, h, encoding);
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }
}
