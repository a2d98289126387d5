package org.qemu4j.rfb;

import org.qemu4j.display.PixelFormat;

import java.io.DataInput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * ServerInit message: initial desktop size, the server's native pixel format and the
 * desktop name.
 */
public record ServerInit(int width, int height, PixelFormat pixelFormat, String name) {

    static final int MAX_NAME_LENGTH = 1 << 16;

    public static ServerInit read(DataInput in) throws IOException {
        int width = in.readUnsignedShort();
        int height = in.readUnsignedShort();
        byte[] format = new byte[PixelFormat.WIRE_LENGTH];
        in.readFully(format);
        PixelFormat pixelFormat;
        try {
            pixelFormat = PixelFormat.fromBytes(format);
        } catch (IllegalArgumentException e) {
            throw new RfbProtocolException("Invalid server pixel format: " + e.getMessage(), e);
        }
        long nameLength = in.readInt() & 0xFFFFFFFFL;
        if (nameLength > MAX_NAME_LENGTH) {
            throw new RfbProtocolException("Desktop name too long: " + nameLength + " bytes");
        }
        byte[] name = new byte[(int) nameLength];
        in.readFully(name);
        return new ServerInit(width, height, pixelFormat, new String(name, StandardCharsets.UTF_8));
    }
}
