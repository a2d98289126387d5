package org.qemu4j.core;

import org.qemu4j.display.EncodedFrame;
import org.qemu4j.display.FrameEncoder;
import org.qemu4j.display.Framebuffer;
import org.qemu4j.rfb.RfbClient;
import org.qemu4j.rfb.RfbProtocolException;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Frame capture on top of {@link RfbClient}.
 * <p>
 * Each {@link #captureFrame()} runs one update cycle and returns the framebuffer as JPEG.
 * The last encoded frame is cached: it is returned as-is when the cycle changed nothing or
 * failed, so once a frame exists callers never get null back.
 * <p>
 * {@link #startStreaming()} runs the capture on a background thread at a fixed frame rate
 * and hands every frame to the registered callback.
 */
public class DisplayCapture implements Closeable {
    private static final Logger LOG = Logger.getLogger(DisplayCapture.class.getName());

    public static final int DEFAULT_FPS = 30;
    public static final int DEFAULT_MAX_RETRIES = 10;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    private static final long MAX_POLL_TIMEOUT_MS = 500;
    private static final long STOP_JOIN_MS = 2_000;

    private final RfbClient client;
    private final FrameEncoder encoder;
    private final int fps;
    private final long frameIntervalNanos;
    private final ReentrantLock captureLock = new ReentrantLock(true);
    private final Object callbackLock = new Object();
    private final AtomicLong sequence = new AtomicLong(0);

    private volatile EncodedFrame lastFrame;
    private long lastEncodedVersion = -1;
    private boolean fullUpdatePending = true;
    private volatile Consumer<byte[]> frameCallback;
    private volatile Thread streamThread;

    public DisplayCapture(InetSocketAddress address, int targetWidth, int targetHeight, int fps) {
        this(new RfbClient(address, RfbClient.DEFAULT_CONNECT_TIMEOUT, pollTimeout(fps), RfbClient.DEFAULT_MESSAGE_TIMEOUT),
                new FrameEncoder(targetWidth, targetHeight), fps);
    }

    public DisplayCapture(RfbClient client, FrameEncoder encoder, int fps) {
        if (fps <= 0) {
            throw new IllegalArgumentException("fps must be positive, got " + fps);
        }
        this.client = Objects.requireNonNull(client, "client");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.fps = fps;
        this.frameIntervalNanos = TimeUnit.SECONDS.toNanos(1) / fps;
    }

    public boolean connect() {
        return connect(DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY);
    }

    /**
     * Connect with a bounded number of attempts. Transport failures (refused, timed out,
     * reset) are retried after {@code retryDelay}; a protocol error aborts at once.
     *
     * @return true once the display connection is active
     */
    public boolean connect(int maxRetries, Duration retryDelay) {
        captureLock.lock();
        try {
            if (client.isConnected()) {
                return true;
            }
            for (int attempt = 0; attempt < maxRetries; attempt++) {
                try {
                    client.connect();
                    fullUpdatePending = true;
                    lastEncodedVersion = -1;
                    return true;
                } catch (RfbProtocolException e) {
                    LOG.log(Level.SEVERE, "VNC handshake failed: " + e.getMessage(), e);
                    return false;
                } catch (IOException e) {
                    LOG.log(Level.FINE, "VNC connection attempt {0} failed: {1}",
                            new Object[]{attempt + 1, e.getMessage()});
                }
                if (attempt < maxRetries - 1 && !sleep(retryDelay)) {
                    break;
                }
            }
            LOG.log(Level.SEVERE, "VNC connection failed after {0} attempts", maxRetries);
            return false;
        } finally {
            captureLock.unlock();
        }
    }

    /**
     * Stop streaming and close the connection. The last frame stays cached.
     */
    public void disconnect() {
        stopStreaming();
        client.disconnect();
    }

    @Override
    public void close() {
        disconnect();
    }

    /**
     * Run one incremental update cycle and return the framebuffer as JPEG.
     *
     * @return the encoded frame, the cached frame if nothing changed or the cycle failed,
     * or null if no frame has been captured yet
     */
    public byte[] captureFrame() {
        EncodedFrame frame = captureEncodedFrame();
        return frame == null ? null : frame.getData();
    }

    /**
     * Like {@link #captureFrame()}, with the frame's sequence number and capture time.
     */
    public EncodedFrame captureEncodedFrame() {
        captureLock.lock();
        try {
            if (!client.isConnected()) {
                return lastFrame;
            }
            if (!runUpdateCycle()) {
                return lastFrame;
            }
            Framebuffer fb = client.getFramebuffer();
            long version = fb.getVersion();
            EncodedFrame cached = lastFrame;
            if (cached != null && version == lastEncodedVersion) {
                return cached;
            }
            BufferedImage image = fb.toImage();
            byte[] jpeg = encoder.encode(image);
            EncodedFrame frame = new EncodedFrame(jpeg, sequence.incrementAndGet(), Instant.now(),
                    encoder.outputWidth(image.getWidth()), encoder.outputHeight(image.getHeight()));
            lastFrame = frame;
            lastEncodedVersion = version;
            return frame;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Frame encoding failed", e);
            return lastFrame;
        } finally {
            captureLock.unlock();
        }
    }

    /**
     * Run one incremental update cycle and return the framebuffer's raw pixels,
     * {@code width * height * 3} bytes in R, G, B order.
     *
     * @return raw pixels, or null if no connection has ever been made
     */
    public byte[] captureFrameRaw() {
        captureLock.lock();
        try {
            if (client.isConnected()) {
                runUpdateCycle();
            }
            Framebuffer fb = client.getFramebuffer();
            return fb == null ? null : fb.toRgbBytes();
        } finally {
            captureLock.unlock();
        }
    }

    /**
     * Callback for frames produced while streaming. Invoked on the streaming thread.
     */
    public void setFrameCallback(Consumer<byte[]> callback) {
        this.frameCallback = callback;
    }

    /**
     * Start the background capture loop. No-op if already streaming. The first cycle asks
     * the server for a full update.
     */
    public synchronized void startStreaming() {
        if (streamThread != null) {
            return;
        }
        captureLock.lock();
        try {
            fullUpdatePending = true;
        } finally {
            captureLock.unlock();
        }
        Thread t = new Thread(this::streamLoop, "qemu4j-display-stream");
        t.setDaemon(true);
        streamThread = t;
        t.start();
        LOG.log(Level.INFO, "Display streaming started at {0} fps", fps);
    }

    /**
     * Stop the capture loop. Once this returns the frame callback is not invoked again, even
     * if the old thread is still finishing a blocked capture cycle.
     */
    public void stopStreaming() {
        Thread t;
        synchronized (this) {
            t = streamThread;
            streamThread = null;
        }
        synchronized (callbackLock) {
            // waits out a callback already in progress
        }
        if (t == null || t == Thread.currentThread()) {
            return;
        }
        t.interrupt();
        try {
            t.join(STOP_JOIN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            LOG.log(Level.FINE, "Streaming thread still finishing a capture cycle");
        }
        LOG.info("Display streaming stopped");
    }

    public boolean isStreaming() {
        return streamThread != null;
    }

    public boolean isConnected() {
        return client.isConnected();
    }

    public Optional<EncodedFrame> getLastFrame() {
        return Optional.ofNullable(lastFrame);
    }

    public int getFps() {
        return fps;
    }

    public RfbClient getClient() {
        return client;
    }

    /**
     * @return true if the cycle completed; false if it failed and the connection is gone
     */
    private boolean runUpdateCycle() {
        try {
            client.requestUpdate(!fullUpdatePending);
            fullUpdatePending = false;
            client.processUpdates();
            return true;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Frame capture error: {0}", e.getMessage());
            LOG.log(Level.FINE, "Frame capture error", e);
            return false;
        }
    }

    private void streamLoop() {
        long next = System.nanoTime();
        try {
            while (isCurrentStreamThread()) {
                EncodedFrame frame = captureEncodedFrame();
                if (!client.isConnected()) {
                    LOG.info("Display connection lost, streaming stopped");
                    break;
                }
                deliver(frame);
                next += frameIntervalNanos;
                long wait = next - System.nanoTime();
                if (wait > 0) {
                    TimeUnit.NANOSECONDS.sleep(wait);
                } else if (-wait > frameIntervalNanos) {
                    // more than a frame behind, restart the schedule instead of bursting
                    next = System.nanoTime();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            synchronized (this) {
                if (streamThread == Thread.currentThread()) {
                    streamThread = null;
                }
            }
        }
    }

    private void deliver(EncodedFrame frame) {
        Consumer<byte[]> callback = frameCallback;
        if (frame == null || callback == null) {
            return;
        }
        synchronized (callbackLock) {
            if (!isCurrentStreamThread()) {
                return;
            }
            try {
                callback.accept(frame.getData());
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Frame callback failed", e);
            }
        }
    }

    private boolean isCurrentStreamThread() {
        return streamThread == Thread.currentThread();
    }

    private static Duration pollTimeout(int fps) {
        long intervalMs = fps > 0 ? 1000L / fps : MAX_POLL_TIMEOUT_MS;
        return Duration.ofMillis(Math.max(10, Math.min(MAX_POLL_TIMEOUT_MS, intervalMs)));
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(Math.max(0, delay.toMillis()));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
