package org.qemu4j.qmp;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class QmpClientTest {

    @Test
    void connect_negotiatesCapabilities() {
        ScriptedLineChannel channel = ScriptedLineChannel.acceptingAll();
        QmpClient client = new QmpClient(() -> channel);

        assertTrue(client.connect());
        assertTrue(client.isConnected());
        assertEquals("qmp_capabilities", channel.requests().get(0).path("execute").asText());
    }

    @Test
    void connect_retriesWhileRefused() {
        AtomicInteger attempts = new AtomicInteger();
        ScriptedLineChannel channel = ScriptedLineChannel.acceptingAll();
        QmpClient client = new QmpClient(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new ConnectException("Connection refused");
            }
            return channel;
        });

        assertTrue(client.connect(5, Duration.ZERO));
        assertEquals(3, attempts.get());
    }

    @Test
    void connect_givesUpAfterMaxRetries() {
        AtomicInteger attempts = new AtomicInteger();
        QmpClient client = new QmpClient(() -> {
            attempts.incrementAndGet();
            throw new ConnectException("Connection refused");
        });

        assertFalse(client.connect(3, Duration.ZERO));
        assertEquals(3, attempts.get());
        assertEquals(QmpClient.State.DISCONNECTED, client.getState());
    }

    @Test
    void connect_abortsOnNonRefusalError() {
        AtomicInteger attempts = new AtomicInteger();
        QmpClient client = new QmpClient(() -> {
            attempts.incrementAndGet();
            throw new IOException("No route to host");
        });

        assertFalse(client.connect(5, Duration.ZERO));
        assertEquals(1, attempts.get());
    }

    @Test
    void connect_failsWhenCapabilitiesRejected() {
        ScriptedLineChannel channel = new ScriptedLineChannel(req -> List.of(
                "{\"error\": {\"class\": \"GenericError\", \"desc\": \"nope\"}}"));
        QmpClient client = new QmpClient(() -> channel);

        assertFalse(client.connect(1, Duration.ZERO));
        assertFalse(channel.isOpen());
    }

    @Test
    void execute_skipsEventsAndReturnsReply() throws Exception {
        ScriptedLineChannel channel = new ScriptedLineChannel(req -> List.of(
                "{\"event\": \"RESET\", \"timestamp\": {\"seconds\": 1, \"microseconds\": 2}}",
                "{\"event\": \"STOP\", \"timestamp\": {\"seconds\": 1, \"microseconds\": 3}}",
                ScriptedLineChannel.reply(req, "{\"status\": \"running\"}")));
        QmpClient client = new QmpClient(() -> channel);
        List<String> events = new CopyOnWriteArrayList<>();
        client.setEventListener(e -> events.add(e.path("event").asText()));
        assertTrue(client.connect());

        JsonNode result = client.execute("query-status");

        assertEquals("running", result.path("status").asText());
        assertTrue(events.containsAll(List.of("RESET", "STOP")));
    }

    @Test
    void execute_errorReplyRaisesCommandException() {
        ScriptedLineChannel channel = new ScriptedLineChannel(req -> List.of(
                "qmp_capabilities".equals(req.path("execute").asText())
                        ? ScriptedLineChannel.reply(req, "{}")
                        : "{\"error\": {\"class\": \"CommandNotFound\", \"desc\": \"The command frobnicate has not been found\"}, \"id\": "
                        + req.path("id").asLong() + "}"));
        QmpClient client = new QmpClient(() -> channel);
        assertTrue(client.connect());

        QmpCommandException e = assertThrows(QmpCommandException.class, () -> client.execute("frobnicate"));

        assertEquals("frobnicate", e.getCommand());
        assertEquals("CommandNotFound", e.getErrorClass());
        assertTrue(e.getDescription().contains("frobnicate"));
        assertTrue(client.isConnected());
    }

    @Test
    void execute_repliesMatchIssueOrder() throws Exception {
        ScriptedLineChannel channel = new ScriptedLineChannel(req -> List.of(
                ScriptedLineChannel.reply(req, "\"" + req.path("execute").asText() + "\"")));
        QmpClient client = new QmpClient(() -> channel);
        assertTrue(client.connect());

        List<String> results = new ArrayList<>();
        for (String cmd : List.of("a", "b", "c", "d")) {
            results.add(client.execute(cmd).asText());
        }

        assertEquals(List.of("a", "b", "c", "d"), results);
    }

    @Test
    void execute_discardsStaleReply() throws Exception {
        ScriptedLineChannel channel = new ScriptedLineChannel(req -> {
            long id = req.path("id").asLong();
            return List.of(
                    "{\"return\": \"late\", \"id\": " + (id - 1) + "}",
                    ScriptedLineChannel.reply(req, "\"fresh\""));
        });
        QmpClient client = new QmpClient(() -> channel);
        assertTrue(client.connect());

        assertEquals("fresh", client.execute("query-name").asText());
    }

    @Test
    void execute_sendsArgumentsAndId() throws Exception {
        ScriptedLineChannel channel = ScriptedLineChannel.acceptingAll();
        QmpClient client = new QmpClient(() -> channel);
        assertTrue(client.connect());

        client.execute("screendump", Map.of("filename", "/tmp/x.ppm"));
        client.execute("query-status");

        List<JsonNode> commands = channel.commands();
        assertEquals("/tmp/x.ppm", commands.get(0).path("arguments").path("filename").asText());
        assertFalse(commands.get(1).has("arguments"));
        assertTrue(commands.get(1).path("id").asLong() > commands.get(0).path("id").asLong());
    }

    @Test
    void execute_serializesConcurrentCallers() throws Exception {
        ScriptedLineChannel channel = ScriptedLineChannel.acceptingAll();
        QmpClient client = new QmpClient(() -> channel);
        assertTrue(client.connect());

        int threads = 4;
        int perThread = 25;
        CountDownLatch done = new CountDownLatch(threads);
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        for (int t = 0; t < threads; t++) {
            new Thread(() -> {
                try {
                    for (int i = 0; i < perThread; i++) {
                        client.execute("query-status");
                    }
                } catch (Throwable e) {
                    failures.add(e);
                } finally {
                    done.countDown();
                }
            }).start();
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        assertTrue(failures.isEmpty(), failures.toString());
        assertEquals(0, channel.overlaps());
        assertEquals(threads * perThread, channel.commands().size());
    }

    @Test
    void execute_connectionClosedMarksDisconnected() {
        ScriptedLineChannel channel = new ScriptedLineChannel(req ->
                "qmp_capabilities".equals(req.path("execute").asText())
                        ? List.of(ScriptedLineChannel.reply(req, "{}"))
                        : List.of(""));
        QmpClient client = new QmpClient(() -> channel);
        assertTrue(client.connect());

        assertThrows(IOException.class, () -> client.execute("quit"));
        assertFalse(client.isConnected());
        assertThrows(IOException.class, () -> client.execute("query-status"));
    }

    @Test
    void execute_replyTimeoutClosesConnection() {
        ScriptedLineChannel channel = new ScriptedLineChannel(req ->
                "qmp_capabilities".equals(req.path("execute").asText())
                        ? List.of(ScriptedLineChannel.reply(req, "{}"))
                        : List.of());
        QmpClient client = new QmpClient(() -> channel);
        assertTrue(client.connect());

        QmpException e = assertThrows(QmpException.class, () -> client.execute("query-status"));
        assertTrue(e.getMessage().contains("Timed out"), e.getMessage());
        assertFalse(client.isConnected());
        assertFalse(channel.isOpen());
    }

    @Test
    void disconnect_isIdempotent() {
        ScriptedLineChannel channel = ScriptedLineChannel.acceptingAll();
        QmpClient client = new QmpClient(() -> channel);
        assertTrue(client.connect());

        client.disconnect();
        client.disconnect();

        assertFalse(client.isConnected());
        assertFalse(channel.isOpen());
    }

    @Test
    void socketTransport_talksToLoopbackServer() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            Thread serverThread = new Thread(() -> serveOnce(server));
            serverThread.setDaemon(true);
            serverThread.start();

            QmpClient client = new QmpClient(new InetSocketAddress(InetAddress.getLoopbackAddress(), server.getLocalPort()));
            assertTrue(client.connect(3, Duration.ofMillis(50)));
            assertEquals("running", client.execute("query-status").path("status").asText());
            client.disconnect();
            serverThread.join(2000);
        }
    }

    private static void serveOnce(ServerSocket server) {
        try (Socket socket = server.accept();
             BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
             PrintWriter out = new PrintWriter(socket.getOutputStream(), true, StandardCharsets.UTF_8)) {
            out.println(ScriptedLineChannel.GREETING);
            in.readLine();
            out.println("{\"return\": {}}");
            in.readLine();
            out.println("{\"timestamp\": {\"seconds\": 5, \"microseconds\": 0}, \"event\": \"NIC_RX_FILTER_CHANGED\"}");
            out.println("{\"return\": {\"status\": \"running\", \"running\": true}}");
            in.readLine();
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
    }
}
