package org.qemu4j.rfb;

import org.qemu4j.display.Framebuffer;
import org.qemu4j.display.PixelFormat;
import org.qemu4j.display.RgbFramebuffer;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * RFB (VNC) client state machine: handshake, then framebuffer update cycles into a
 * client-owned {@link Framebuffer}.
 * <p>
 * States move {@code DISCONNECTED -> CONNECTING -> HANDSHAKING -> ACTIVE}; any transport or
 * protocol error, or {@link #disconnect()}, moves back to {@code DISCONNECTED}. There is no
 * reconnect here, callers retry {@link #connect()} with their own policy.
 * <p>
 * The client asks for {@link PixelFormat#PREFERRED} and only the Raw and DesktopSize
 * encodings. Other rectangles whose payload length is known are consumed and ignored.
 * <p>
 * One thread drives the update cycle. {@link #disconnect()} may be called from any thread
 * and unblocks a pending read.
 */
public class RfbClient implements Closeable {
    private static final Logger LOG = Logger.getLogger(RfbClient.class.getName());
    private static final boolean DEBUG = Boolean.parseBoolean(System.getenv("QEMU4J_DEBUG"));

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);
    public static final Duration DEFAULT_MESSAGE_TIMEOUT = Duration.ofSeconds(5);
    private static final int[] ENCODINGS = {RfbMessages.ENCODING_RAW, RfbMessages.ENCODING_DESKTOP_SIZE};
    private static final int SKIP_CHUNK = 64 * 1024;

    public enum State {
        DISCONNECTED,
        CONNECTING,
        HANDSHAKING,
        ACTIVE
    }

    private final InetSocketAddress address;
    private final int connectTimeoutMs;
    private final int pollTimeoutMs;
    private final int messageTimeoutMs;
    private final PixelFormat pixelFormat = PixelFormat.PREFERRED;

    private volatile State state = State.DISCONNECTED;
    private volatile Socket socket;
    private DataInputStream in;
    private DataOutputStream out;
    private volatile Framebuffer framebuffer;
    private RfbMessages.Version version;
    private ServerInit serverInit;

    public RfbClient(InetSocketAddress address) {
        this(address, DEFAULT_CONNECT_TIMEOUT, DEFAULT_POLL_TIMEOUT, DEFAULT_MESSAGE_TIMEOUT);
    }

    /**
     * @param pollTimeout    how long one update cycle waits for the first byte of a server message
     * @param messageTimeout read timeout for the rest of a message once it has started, and for the handshake
     */
    public RfbClient(InetSocketAddress address, Duration connectTimeout, Duration pollTimeout, Duration messageTimeout) {
        this.address = Objects.requireNonNull(address, "address");
        this.connectTimeoutMs = toTimeout(connectTimeout);
        this.pollTimeoutMs = toTimeout(pollTimeout);
        this.messageTimeoutMs = toTimeout(messageTimeout);
    }

    /**
     * Open the socket and run the handshake. On return the client is {@code ACTIVE} and the
     * framebuffer has the size the server advertised, all black.
     *
     * @throws RfbProtocolException if the server refused or sent something malformed
     * @throws IOException          if the connection failed or timed out
     */
    public void connect() throws IOException {
        if (state == State.ACTIVE) {
            return;
        }
        state = State.CONNECTING;
        Socket s = new Socket();
        socket = s;
        try {
            s.setTcpNoDelay(true);
            s.connect(address, connectTimeoutMs);
            s.setSoTimeout(messageTimeoutMs);
            in = new DataInputStream(new BufferedInputStream(s.getInputStream()));
            out = new DataOutputStream(new BufferedOutputStream(s.getOutputStream()));
            state = State.HANDSHAKING;
            handshake();
            state = State.ACTIVE;
        } catch (IOException | RuntimeException e) {
            closeSocket();
            throw e;
        }
        ServerInit init = serverInit;
        LOG.log(Level.INFO, "VNC connected to {0}:{1} - {2}x{3} {4}bpp ''{5}'' (RFB {6})",
                new Object[]{address.getHostString(), String.valueOf(address.getPort()), String.valueOf(init.width()),
                        String.valueOf(init.height()), init.pixelFormat().getBitsPerPixel(), init.name(), version});
    }

    /**
     * Close the connection. Idempotent; a blocked update cycle fails with an {@link IOException}.
     */
    public void disconnect() {
        boolean wasOpen = socket != null;
        closeSocket();
        if (wasOpen) {
            LOG.info("VNC disconnected");
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    /**
     * Ask for an update of the whole framebuffer.
     *
     * @param incremental false to have the server send every pixel, not just what changed
     */
    public void requestUpdate(boolean incremental) throws IOException {
        ensureActive();
        Framebuffer fb = framebuffer;
        try {
            RfbMessages.writeFramebufferUpdateRequest(out, incremental, 0, 0, fb.getWidth(), fb.getHeight());
            out.flush();
        } catch (IOException e) {
            closeSocket();
            throw e;
        }
    }

    /**
     * Read server messages until a framebuffer update has been applied and nothing more is
     * buffered, or until no message starts within the poll timeout. Bell, clipboard and
     * colour-map messages are consumed along the way.
     *
     * @return true if the framebuffer changed
     * @throws IOException on transport or framing errors; the client is disconnected
     */
    public boolean processUpdates() throws IOException {
        ensureActive();
        Socket s = socket;
        boolean updated = false;
        try {
            while (true) {
                int type = pollMessageType(s);
                if (type < 0) {
                    return updated;
                }
                s.setSoTimeout(messageTimeoutMs);
                if (readMessage(type)) {
                    updated = true;
                }
                if (updated && in.available() == 0) {
                    return true;
                }
            }
        } catch (IOException | RuntimeException e) {
            closeSocket();
            throw e;
        }
    }

    public State getState() {
        return state;
    }

    public boolean isConnected() {
        return state == State.ACTIVE;
    }

    /**
     * The framebuffer of the current or last connection, or null before the first handshake.
     */
    public Framebuffer getFramebuffer() {
        return framebuffer;
    }

    public PixelFormat getPixelFormat() {
        return pixelFormat;
    }

    /**
     * ServerInit of the current or last connection, or null before the first handshake.
     */
    public ServerInit getServerInit() {
        return serverInit;
    }

    public RfbMessages.Version getVersion() {
        return version;
    }

    public InetSocketAddress getAddress() {
        return address;
    }

    private void handshake() throws IOException {
        byte[] serverVersion = new byte[RfbMessages.VERSION_LENGTH];
        in.readFully(serverVersion);
        RfbMessages.Version v = RfbMessages.Version.negotiate(serverVersion);
        out.write(v.toBytes());
        out.flush();
        version = v;
        LOG.log(Level.FINE, "RFB server offered {0}, using {1}",
                new Object[]{new String(serverVersion, 0, 11, StandardCharsets.US_ASCII), v});

        if (v == RfbMessages.Version.V3_3) {
            int type = in.readInt();
            if (type == RfbMessages.SECURITY_INVALID) {
                throw new RfbProtocolException("VNC connection refused: " + RfbMessages.readReason(in));
            }
            if (type != RfbMessages.SECURITY_NONE) {
                throw new RfbProtocolException("No supported security type (need None auth), server requires " + type);
            }
        } else {
            int count = in.readUnsignedByte();
            if (count == 0) {
                throw new RfbProtocolException("VNC connection refused: " + RfbMessages.readReason(in));
            }
            byte[] types = new byte[count];
            in.readFully(types);
            if (!contains(types, RfbMessages.SECURITY_NONE)) {
                throw new RfbProtocolException("No supported security type (need None auth), server offered "
                        + describe(types));
            }
            out.writeByte(RfbMessages.SECURITY_NONE);
            out.flush();
            if (v == RfbMessages.Version.V3_8) {
                int result = in.readInt();
                if (result != 0) {
                    throw new RfbProtocolException("Security handshake failed (" + result + "): "
                            + RfbMessages.readReason(in));
                }
            }
        }

        out.writeByte(1);
        out.flush();

        ServerInit init = ServerInit.read(in);
        if (init.width() == 0 || init.height() == 0) {
            throw new RfbProtocolException("Server advertised an empty desktop " + init.width() + "x" + init.height());
        }
        serverInit = init;
        framebuffer = new RgbFramebuffer(init.width(), init.height());

        RfbMessages.writeSetPixelFormat(out, pixelFormat);
        RfbMessages.writeSetEncodings(out, ENCODINGS);
        out.flush();
    }

    /**
     * First byte of the next message, or -1 if none started within the poll timeout.
     */
    private int pollMessageType(Socket s) throws IOException {
        s.setSoTimeout(pollTimeoutMs);
        try {
            int type = in.read();
            if (type < 0) {
                throw new IOException("VNC connection closed by server");
            }
            return type;
        } catch (SocketTimeoutException e) {
            return -1;
        }
    }

    /**
     * @return true if the message was a framebuffer update
     */
    private boolean readMessage(int type) throws IOException {
        switch (type) {
            case RfbMessages.SERVER_FRAMEBUFFER_UPDATE:
                readFramebufferUpdate();
                return true;
            case RfbMessages.SERVER_SET_COLOUR_MAP_ENTRIES: {
                in.readUnsignedByte();
                in.readUnsignedShort();
                int colours = in.readUnsignedShort();
                skip(colours * 6L);
                LOG.log(Level.FINE, "Ignoring {0} colour map entries", colours);
                return false;
            }
            case RfbMessages.SERVER_BELL:
                LOG.fine("VNC bell");
                return false;
            case RfbMessages.SERVER_CUT_TEXT: {
                skip(3);
                long length = in.readInt() & 0xFFFFFFFFL;
                skip(length);
                LOG.log(Level.FINE, "Ignoring {0} bytes of server clipboard text", length);
                return false;
            }
            default:
                throw new RfbProtocolException("Unknown server message type " + type);
        }
    }

    private void readFramebufferUpdate() throws IOException {
        in.readUnsignedByte();
        int count = in.readUnsignedShort();
        Framebuffer fb = framebuffer;
        for (int i = 0; i < count; i++) {
            RectangleUpdate rect = RectangleUpdate.read(in);
            if (DEBUG) {
                LOG.log(Level.INFO, "RFB rect {0}", rect);
            }
            if (rect.encoding() == RfbMessages.ENCODING_RAW) {
                long length = (long) rect.width() * rect.height() * pixelFormat.bytesPerPixel();
                if (length == 0) {
                    continue;
                }
                if (length > Integer.MAX_VALUE) {
                    throw new RfbProtocolException("Raw rectangle too large: " + rect);
                }
                byte[] pixels = new byte[(int) length];
                in.readFully(pixels);
                fb.blit(rect.x(), rect.y(), rect.width(), rect.height(), pixels, 0, pixelFormat);
            } else if (rect.encoding() == RfbMessages.ENCODING_DESKTOP_SIZE) {
                if (rect.isEmpty()) {
                    throw new RfbProtocolException("Desktop resized to empty " + rect.width() + "x" + rect.height());
                }
                fb.resize(rect.width(), rect.height());
                LOG.log(Level.INFO, "VNC desktop resized to {0}x{1}",
                        new Object[]{String.valueOf(rect.width()), String.valueOf(rect.height())});
            } else if (rect.encoding() == RfbMessages.ENCODING_LAST_RECT) {
                // count was a placeholder (usually 0xFFFF)
                return;
            } else {
                long length = RfbMessages.skippableLength(rect, pixelFormat.bytesPerPixel());
                if (length < 0) {
                    throw new RfbProtocolException("Unsupported encoding "
                            + RfbMessages.encodingName(rect.encoding()) + " with unknown length");
                }
                LOG.log(Level.WARNING, "Unsupported encoding: {0}, skipping {1} bytes",
                        new Object[]{RfbMessages.encodingName(rect.encoding()), length});
                skip(length);
            }
        }
    }

    private void skip(long length) throws IOException {
        long remaining = length;
        while (remaining > 0) {
            int n = (int) Math.min(remaining, SKIP_CHUNK);
            in.skipNBytes(n);
            remaining -= n;
        }
    }

    private void ensureActive() throws IOException {
        if (state != State.ACTIVE || socket == null) {
            throw new IOException("VNC not connected");
        }
    }

    private void closeSocket() {
        Socket s = socket;
        socket = null;
        state = State.DISCONNECTED;
        if (s != null) {
            try {
                s.close();
            } catch (IOException e) {
                LOG.log(Level.FINE, "Error closing VNC socket", e);
            }
        }
    }

    private static boolean contains(byte[] types, int wanted) {
        for (byte t : types) {
            if ((t & 0xFF) == wanted) {
                return true;
            }
        }
        return false;
    }

    private static String describe(byte[] types) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < types.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(types[i] & 0xFF);
        }
        return sb.append(']').toString();
    }

    private static int toTimeout(Duration d) {
        long ms = Objects.requireNonNull(d, "timeout").toMillis();
        if (ms <= 0 || ms > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Timeout must be positive, got " + d);
        }
        return (int) ms;
    }
}
