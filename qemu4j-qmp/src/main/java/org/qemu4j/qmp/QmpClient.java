package org.qemu4j.qmp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.Closeable;
import java.io.IOException;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * QMP (QEMU Machine Protocol) client: newline-delimited JSON over a {@link LineChannel}.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>{@link #connect()} reads the greeting and negotiates with {@code qmp_capabilities}</li>
 *   <li>{@link #execute(String, Map)} sends one command and waits for its reply</li>
 *   <li>{@link #disconnect()} closes the channel</li>
 * </ul>
 * Only one command is in flight at a time; concurrent callers queue on a fair lock.
 * Event messages that arrive while waiting for a reply are handed to the event listener
 * and never returned as a reply.
 */
public class QmpClient implements Closeable {
    private static final Logger LOG = Logger.getLogger(QmpClient.class.getName());
    private static final boolean DEBUG = Boolean.parseBoolean(System.getenv("QEMU4J_DEBUG"));
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    private static final int CONNECT_TIMEOUT_MS = 5_000;
    private static final int READ_TIMEOUT_MS = 10_000;

    public enum State {
        DISCONNECTED,
        CONNECTING,
        CONNECTED
    }

    /**
     * Opens a fresh channel for each connection attempt.
     */
    @FunctionalInterface
    public interface ChannelFactory {
        LineChannel open() throws IOException;
    }

    private final ChannelFactory channelFactory;
    private final ReentrantLock lock = new ReentrantLock(true);
    private final AtomicLong requestIds = new AtomicLong(0);
    private volatile LineChannel channel;
    private volatile State state = State.DISCONNECTED;
    private volatile long inFlightId = -1;
    private volatile Consumer<JsonNode> eventListener;

    public QmpClient(InetSocketAddress address) {
        this(() -> SocketLineChannel.connect(address, CONNECT_TIMEOUT_MS, READ_TIMEOUT_MS));
    }

    public QmpClient(ChannelFactory channelFactory) {
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
    }

    public boolean connect() {
        return connect(DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY);
    }

    /**
     * Connect and negotiate capabilities. Connection-refused is retried up to
     * {@code maxRetries} attempts with a fixed delay; any other failure aborts immediately.
     *
     * @return true once the session is connected
     */
    public boolean connect(int maxRetries, Duration retryDelay) {
        lock.lock();
        try {
            if (state == State.CONNECTED) {
                return true;
            }
            for (int attempt = 0; attempt < maxRetries; attempt++) {
                state = State.CONNECTING;
                try {
                    channel = channelFactory.open();
                    JsonNode greeting = readMessage();
                    if (!greeting.has("QMP")) {
                        throw new QmpException("Unexpected QMP greeting: " + greeting);
                    }
                    LOG.log(Level.FINE, "QMP greeting: {0}", greeting);
                    exchange("qmp_capabilities", null);
                    state = State.CONNECTED;
                    LOG.info("QMP connected successfully");
                    return true;
                } catch (ConnectException e) {
                    closeChannel();
                    LOG.log(Level.FINE, "QMP connection attempt {0} refused", attempt + 1);
                    if (attempt < maxRetries - 1 && !sleep(retryDelay)) {
                        break;
                    }
                } catch (IOException e) {
                    closeChannel();
                    LOG.log(Level.SEVERE, "QMP connection error", e);
                    break;
                }
            }
            closeChannel();
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the connection. Idempotent. Does not wait for an in-flight command; that
     * command fails with an {@link IOException}.
     */
    public void disconnect() {
        boolean wasConnected = channel != null;
        closeChannel();
        if (wasConnected) {
            LOG.info("QMP disconnected");
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    public JsonNode execute(String command) throws IOException {
        return execute(command, null);
    }

    /**
     * Execute a command and return its {@code return} payload.
     *
     * @param arguments command arguments, serialized with Jackson; null or empty omits the field
     * @throws QmpCommandException if the server replied with an error
     * @throws QmpException        on a malformed reply (connection kept) or a reply timeout (connection closed)
     * @throws IOException         if the transport failed (connection closed)
     */
    public JsonNode execute(String command, Map<String, ?> arguments) throws IOException {
        Objects.requireNonNull(command, "command");
        lock.lock();
        try {
            if (state != State.CONNECTED || channel == null) {
                throw new IOException("QMP not connected");
            }
            return exchange(command, arguments);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Listener for asynchronous QMP events skipped while waiting for replies.
     */
    public void setEventListener(Consumer<JsonNode> eventListener) {
        this.eventListener = eventListener;
    }

    public boolean isConnected() {
        return state == State.CONNECTED;
    }

    public State getState() {
        return state;
    }

    private JsonNode exchange(String command, Map<String, ?> arguments) throws IOException {
        long id = requestIds.incrementAndGet();
        ObjectNode request = MAPPER.createObjectNode();
        request.put("execute", command);
        if (arguments != null && !arguments.isEmpty()) {
            request.set("arguments", MAPPER.valueToTree(arguments));
        }
        request.put("id", id);
        inFlightId = id;
        try {
            String line = MAPPER.writeValueAsString(request);
            if (DEBUG) {
                LOG.log(Level.INFO, "QMP tx {0}", line);
            }
            write(line);
            while (true) {
                JsonNode reply = readMessage();
                if (reply.has("event")) {
                    deliverEvent(reply);
                    continue;
                }
                JsonNode replyId = reply.get("id");
                if (replyId != null && replyId.asLong(-1) != id) {
                    LOG.log(Level.FINE, "Discarding stale QMP reply {0} while waiting for {1}",
                            new Object[]{replyId, id});
                    continue;
                }
                if (reply.has("error")) {
                    throw new QmpCommandException(command, reply.get("error"));
                }
                if (reply.has("return")) {
                    return reply.get("return");
                }
                LOG.log(Level.FINE, "Ignoring unrecognized QMP message {0}", reply);
            }
        } finally {
            inFlightId = -1;
        }
    }

    private void write(String line) throws IOException {
        LineChannel ch = channel;
        if (ch == null) {
            throw new IOException("QMP not connected");
        }
        try {
            ch.writeLine(line);
        } catch (IOException e) {
            closeChannel();
            throw e;
        }
    }

    private JsonNode readMessage() throws IOException {
        LineChannel ch = channel;
        if (ch == null) {
            throw new IOException("QMP not connected");
        }
        String line;
        try {
            line = ch.readLine();
        } catch (SocketTimeoutException e) {
            // a partially read line is lost, so the stream can no longer be framed
            closeChannel();
            throw new QmpException("Timed out waiting for QMP reply (request " + inFlightId + ")", e);
        } catch (IOException e) {
            closeChannel();
            throw e;
        }
        if (line == null) {
            closeChannel();
            throw new IOException("QMP connection closed by peer");
        }
        if (DEBUG) {
            LOG.log(Level.INFO, "QMP rx {0}", line);
        }
        try {
            JsonNode node = MAPPER.readTree(line);
            if (node == null || !node.isObject()) {
                throw new QmpException("QMP message is not a JSON object: " + line);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new QmpException("Malformed QMP message: " + line, e);
        }
    }

    private void deliverEvent(JsonNode event) {
        LOG.log(Level.FINE, "QMP event {0}", event.path("event").asText());
        Consumer<JsonNode> listener = eventListener;
        if (listener == null) {
            return;
        }
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "QMP event listener failed", e);
        }
    }

    private void closeChannel() {
        LineChannel ch = channel;
        channel = null;
        state = State.DISCONNECTED;
        if (ch != null) {
            ch.close();
        }
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
