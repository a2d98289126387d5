package org.qemu4j.rfb;

import org.qemu4j.display.PixelFormat;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RFB (remote framebuffer) message constants and the client-to-server messages.
 * All multi-byte fields are big-endian.
 * <pre>
 *   SetPixelFormat           [1B] 0  [3B] pad  [16B] pixel format
 *   SetEncodings             [1B] 2  [1B] pad  [2B] count  [4B]* encoding
 *   FramebufferUpdateRequest [1B] 3  [1B] incremental  [2B] x  [2B] y  [2B] w  [2B] h
 * </pre>
 */
public final class RfbMessages {

    public static final int VERSION_LENGTH = 12;
    public static final int SECURITY_INVALID = 0;
    public static final int SECURITY_NONE = 1;

    public static final int CLIENT_SET_PIXEL_FORMAT = 0;
    public static final int CLIENT_SET_ENCODINGS = 2;
    public static final int CLIENT_FRAMEBUFFER_UPDATE_REQUEST = 3;

    public static final int SERVER_FRAMEBUFFER_UPDATE = 0;
    public static final int SERVER_SET_COLOUR_MAP_ENTRIES = 1;
    public static final int SERVER_BELL = 2;
    public static final int SERVER_CUT_TEXT = 3;

    public static final int ENCODING_RAW = 0;
    public static final int ENCODING_COPY_RECT = 1;
    public static final int ENCODING_DESKTOP_SIZE = -223;
    public static final int ENCODING_LAST_RECT = -224;
    public static final int ENCODING_CURSOR = -239;

    static final int MAX_REASON_LENGTH = 1 << 16;

    private static final Pattern VERSION = Pattern.compile("RFB (\\d{3})\\.(\\d{3})\n");

    private RfbMessages() {
    }

    /**
     * Protocol versions this client speaks.
     */
    public enum Version {
        V3_3(3),
        V3_7(7),
        V3_8(8);

        private final int minor;

        Version(int minor) {
            this.minor = minor;
        }

        public int minor() {
            return minor;
        }

        public byte[] toBytes() {
            return String.format("RFB 003.%03d\n", minor).getBytes(StandardCharsets.US_ASCII);
        }

        /**
         * Highest version not above the one the server offered. Unknown 3.x minors in
         * between fall back to 3.3, as the RFB documentation prescribes.
         */
        public static Version negotiate(byte[] serverVersion) throws RfbProtocolException {
            String text = new String(serverVersion, StandardCharsets.US_ASCII);
            Matcher m = VERSION.matcher(text);
            if (!m.matches()) {
                throw new RfbProtocolException("Not an RFB server, got version string '" + text.trim() + "'");
            }
            int major = Integer.parseInt(m.group(1));
            int minor = Integer.parseInt(m.group(2));
            if (major < 3) {
                throw new RfbProtocolException("Unsupported RFB version " + major + "." + minor);
            }
            if (major > 3 || minor >= 8) {
                return V3_8;
            }
            return minor == 7 ? V3_7 : V3_3;
        }

        @Override
        public String toString() {
            return "3." + minor;
        }
    }

    public static void writeSetPixelFormat(DataOutput out, PixelFormat format) throws IOException {
        out.writeByte(CLIENT_SET_PIXEL_FORMAT);
        out.write(new byte[3]);
        out.write(format.toBytes());
    }

    public static void writeSetEncodings(DataOutput out, int... encodings) throws IOException {
        out.writeByte(CLIENT_SET_ENCODINGS);
        out.writeByte(0);
        out.writeShort(encodings.length);
        for (int encoding : encodings) {
            out.writeInt(encoding);
        }
    }

    public static void writeFramebufferUpdateRequest(DataOutput out, boolean incremental,
                                                     int x, int y, int width, int height) throws IOException {
        out.writeByte(CLIENT_FRAMEBUFFER_UPDATE_REQUEST);
        out.writeByte(incremental ? 1 : 0);
        out.writeShort(x);
        out.writeShort(y);
        out.writeShort(width);
        out.writeShort(height);
    }

    /**
     * Read a u32 length followed by that many bytes of text, used for failure reasons.
     */
    static String readReason(DataInput in) throws IOException {
        long length = in.readInt() & 0xFFFFFFFFL;
        if (length > MAX_REASON_LENGTH) {
            throw new RfbProtocolException("Failure reason too long: " + length + " bytes");
        }
        byte[] reason = new byte[(int) length];
        in.readFully(reason);
        return new String(reason, StandardCharsets.UTF_8);
    }

    /**
     * Payload length of an encoding this client does not decode, or -1 when it cannot be
     * computed from the rectangle header alone.
     */
    static long skippableLength(RectangleUpdate rect, int bytesPerPixel) {
        switch (rect.encoding()) {
            case ENCODING_COPY_RECT:
                return 4;
            case ENCODING_LAST_RECT:
                return 0;
            case ENCODING_CURSOR:
                return (long) rect.width() * rect.height() * bytesPerPixel
                        + (long) ((rect.width() + 7) / 8) * rect.height();
            default:
                return -1;
        }
    }

    static String encodingName(int encoding) {
        switch (encoding) {
            case ENCODING_RAW:
                return "Raw";
            case ENCODING_COPY_RECT:
                return "CopyRect";
            case 2:
                return "RRE";
            case 5:
                return "Hextile";
            case 6:
                return "zlib";
            case 7:
                return "Tight";
            case 16:
                return "ZRLE";
            case ENCODING_DESKTOP_SIZE:
                return "DesktopSize";
            case ENCODING_LAST_RECT:
                return "LastRect";
            case ENCODING_CURSOR:
                return "Cursor";
            default:
                return String.valueOf(encoding);
        }
    }
}
