package org.qemu4j.rfb;

import org.junit.jupiter.api.Test;
import org.qemu4j.display.Framebuffer;
import org.qemu4j.display.PixelFormat;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RfbClientTest {

    @Test
    void handshake_allocatesAdvertisedFramebufferAndNegotiatesFormat() throws Exception {
        AtomicReference<FakeRfbServer.ClientSetup> setup = new AtomicReference<>();
        try (FakeRfbServer server = new FakeRfbServer(
                (in, out) -> setup.set(FakeRfbServer.handshake(in, out, 1024, 768)))) {
            RfbClient client = client(server);
            client.connect();

            assertEquals(RfbClient.State.ACTIVE, client.getState());
            Framebuffer fb = client.getFramebuffer();
            assertEquals(1024, fb.getWidth());
            assertEquals(768, fb.getHeight());
            for (byte b : fb.toRgbBytes()) {
                assertEquals(0, b);
            }
            assertEquals("QEMU (test)", client.getServerInit().name());
            assertEquals(RfbMessages.Version.V3_8, client.getVersion());

            client.disconnect();
            server.await();
        }
        FakeRfbServer.ClientSetup sent = setup.get();
        assertEquals("RFB 003.008\n", sent.version());
        assertEquals(RfbMessages.SECURITY_NONE, sent.security());
        assertEquals(1, sent.shared());
        assertEquals(PixelFormat.PREFERRED, sent.format());
        assertArrayEquals(new int[]{RfbMessages.ENCODING_RAW, RfbMessages.ENCODING_DESKTOP_SIZE}, sent.encodings());
    }

    @Test
    void rawRectangle_updatesOnlyItsPixels() throws Exception {
        List<FakeRfbServer.UpdateRequest> requests = new CopyOnWriteArrayList<>();
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> {
            FakeRfbServer.handshake(in, out, 64, 48);
            requests.add(FakeRfbServer.readUpdateRequest(in));
            out.write(new FakeRfbServer.Update()
                    .raw(10, 10, 2, 2, 0xFF0000, 0x00FF00, 0x0000FF, 0x123456)
                    .toBytes());
        })) {
            RfbClient client = client(server);
            client.connect();
            client.requestUpdate(false);

            assertTrue(client.processUpdates());

            Framebuffer fb = client.getFramebuffer();
            assertEquals(0xFF0000, fb.getPixel(10, 10));
            assertEquals(0x00FF00, fb.getPixel(11, 10));
            assertEquals(0x0000FF, fb.getPixel(10, 11));
            assertEquals(0x123456, fb.getPixel(11, 11));
            assertEquals(4, countNonBlack(fb));

            client.disconnect();
            server.await();
        }
        assertEquals(new FakeRfbServer.UpdateRequest(false, 0, 0, 64, 48), requests.get(0));
    }

    @Test
    void desktopSize_reallocatesFramebuffer() throws Exception {
        List<FakeRfbServer.UpdateRequest> requests = new CopyOnWriteArrayList<>();
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> {
            FakeRfbServer.handshake(in, out, 1024, 768);
            requests.add(FakeRfbServer.readUpdateRequest(in));
            out.write(new FakeRfbServer.Update().desktopSize(1280, 720).toBytes());
            out.flush();
            requests.add(FakeRfbServer.readUpdateRequest(in));
        })) {
            RfbClient client = client(server);
            client.connect();
            client.requestUpdate(true);

            assertTrue(client.processUpdates());
            assertEquals(1280 * 720 * Framebuffer.CHANNELS, client.getFramebuffer().toRgbBytes().length);

            client.requestUpdate(true);
            client.disconnect();
            server.await();
        }
        assertEquals(new FakeRfbServer.UpdateRequest(true, 0, 0, 1280, 720), requests.get(1));
    }

    @Test
    void otherMessagesAndKnownLengthEncodings_areConsumed() throws Exception {
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> {
            FakeRfbServer.handshake(in, out, 32, 32);
            FakeRfbServer.readUpdateRequest(in);
            ByteArrayOutputStream burst = new ByteArrayOutputStream();
            DataOutputStream msg = new DataOutputStream(burst);
            msg.writeByte(RfbMessages.SERVER_BELL);
            msg.writeByte(RfbMessages.SERVER_CUT_TEXT);
            msg.write(new byte[3]);
            msg.writeInt(5);
            msg.write("hello".getBytes(StandardCharsets.US_ASCII));
            msg.writeByte(RfbMessages.SERVER_SET_COLOUR_MAP_ENTRIES);
            msg.writeByte(0);
            msg.writeShort(0);
            msg.writeShort(2);
            msg.write(new byte[12]);
            msg.write(new FakeRfbServer.Update()
                    .rect(0, 0, 2, 2, RfbMessages.ENCODING_CURSOR, new byte[2 * 2 * 4 + 2])
                    .rect(4, 4, 2, 2, RfbMessages.ENCODING_COPY_RECT, new byte[]{0, 1, 0, 1})
                    .raw(0, 0, 1, 1, 0xABCDEF)
                    .toBytes());
            out.write(burst.toByteArray());
        })) {
            RfbClient client = client(server);
            client.connect();
            client.requestUpdate(true);

            assertTrue(client.processUpdates());
            assertEquals(0xABCDEF, client.getFramebuffer().getPixel(0, 0));
            assertEquals(1, countNonBlack(client.getFramebuffer()));
            assertTrue(client.isConnected());

            client.disconnect();
            server.await();
        }
    }

    @Test
    void encodingWithUnknownLength_isProtocolError() throws Exception {
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> {
            FakeRfbServer.handshake(in, out, 32, 32);
            FakeRfbServer.readUpdateRequest(in);
            out.write(new FakeRfbServer.Update().rect(0, 0, 8, 8, 7, new byte[16]).toBytes());
        })) {
            RfbClient client = client(server);
            client.connect();
            client.requestUpdate(true);

            RfbProtocolException e = assertThrows(RfbProtocolException.class, client::processUpdates);
            assertTrue(e.getMessage().contains("Tight"), e.getMessage());
            assertEquals(RfbClient.State.DISCONNECTED, client.getState());
            server.await();
        }
    }

    @Test
    void oversizedRawRectangle_isProtocolError() throws Exception {
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> {
            FakeRfbServer.handshake(in, out, 32, 32);
            FakeRfbServer.readUpdateRequest(in);
            out.write(new FakeRfbServer.Update()
                    .rect(0, 0, 65535, 16385, RfbMessages.ENCODING_RAW, new byte[0]).toBytes());
        })) {
            RfbClient client = client(server);
            client.connect();
            client.requestUpdate(true);

            RfbProtocolException e = assertThrows(RfbProtocolException.class, client::processUpdates);
            assertTrue(e.getMessage().contains("too large"), e.getMessage());
            assertEquals(RfbClient.State.DISCONNECTED, client.getState());
            server.await();
        }
    }

    @Test
    void processUpdates_returnsFalseWhenServerIsQuiet() throws Exception {
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> FakeRfbServer.handshake(in, out, 16, 16))) {
            RfbClient client = new RfbClient(server.address(), Duration.ofSeconds(2), Duration.ofMillis(100),
                    Duration.ofSeconds(2));
            client.connect();

            assertFalse(client.processUpdates());
            assertTrue(client.isConnected());

            client.disconnect();
            server.await();
        }
    }

    @Test
    void serverClose_disconnectsClient() throws Exception {
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> {
            FakeRfbServer.handshake(in, out, 16, 16);
            out.close();
        })) {
            RfbClient client = client(server);
            client.connect();

            assertThrows(IOException.class, client::processUpdates);
            assertEquals(RfbClient.State.DISCONNECTED, client.getState());
            assertThrows(IOException.class, () -> client.requestUpdate(true));
            server.await();
        }
    }

    @Test
    void disconnect_unblocksPendingRead() throws Exception {
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> FakeRfbServer.handshake(in, out, 16, 16))) {
            RfbClient client = new RfbClient(server.address(), Duration.ofSeconds(2), Duration.ofSeconds(30),
                    Duration.ofSeconds(30));
            client.connect();
            CompletableFuture<Boolean> pending = CompletableFuture.supplyAsync(() -> {
                try {
                    return client.processUpdates();
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            });
            Thread.sleep(200);

            client.disconnect();

            assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
            assertEquals(RfbClient.State.DISCONNECTED, client.getState());
            server.await();
        }
    }

    @Test
    void securityWithoutNone_fails() throws Exception {
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> {
            out.write("RFB 003.008\n".getBytes(StandardCharsets.US_ASCII));
            FakeRfbServer.readVersion(in);
            out.writeByte(2);
            out.writeByte(2);
            out.writeByte(16);
        })) {
            RfbClient client = client(server);

            RfbProtocolException e = assertThrows(RfbProtocolException.class, client::connect);
            assertTrue(e.getMessage().contains("None"), e.getMessage());
            assertEquals(RfbClient.State.DISCONNECTED, client.getState());
            server.await();
        }
    }

    @Test
    void nonZeroSecurityResult_failsWithReason() throws Exception {
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> {
            out.write("RFB 003.008\n".getBytes(StandardCharsets.US_ASCII));
            FakeRfbServer.readVersion(in);
            out.writeByte(1);
            out.writeByte(RfbMessages.SECURITY_NONE);
            out.flush();
            in.readUnsignedByte();
            out.writeInt(1);
            FakeRfbServer.writeReason(out, "too many connections");
        })) {
            RfbClient client = client(server);

            RfbProtocolException e = assertThrows(RfbProtocolException.class, client::connect);
            assertTrue(e.getMessage().contains("too many connections"), e.getMessage());
            assertFalse(client.isConnected());
            server.await();
        }
    }

    @Test
    void emptySecurityList_surfacesServerReason() throws Exception {
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> {
            out.write("RFB 003.008\n".getBytes(StandardCharsets.US_ASCII));
            FakeRfbServer.readVersion(in);
            out.writeByte(0);
            FakeRfbServer.writeReason(out, "display is busy");
        })) {
            RfbClient client = client(server);

            RfbProtocolException e = assertThrows(RfbProtocolException.class, client::connect);
            assertTrue(e.getMessage().contains("display is busy"), e.getMessage());
            server.await();
        }
    }

    @Test
    void version33_usesServerChosenSecurityType() throws Exception {
        AtomicReference<FakeRfbServer.ClientSetup> setup = new AtomicReference<>();
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> {
            out.write("RFB 003.003\n".getBytes(StandardCharsets.US_ASCII));
            String version = FakeRfbServer.readVersion(in);
            out.writeInt(RfbMessages.SECURITY_NONE);
            out.flush();
            setup.set(FakeRfbServer.serverInit(in, out, 800, 600, version, RfbMessages.SECURITY_NONE));
        })) {
            RfbClient client = client(server);
            client.connect();

            assertEquals(RfbMessages.Version.V3_3, client.getVersion());
            assertEquals(800, client.getFramebuffer().getWidth());

            client.disconnect();
            server.await();
        }
        assertEquals("RFB 003.003\n", setup.get().version());
    }

    @Test
    void version37_skipsSecurityResultForNone() throws Exception {
        try (FakeRfbServer server = new FakeRfbServer((in, out) -> {
            out.write("RFB 003.007\n".getBytes(StandardCharsets.US_ASCII));
            String version = FakeRfbServer.readVersion(in);
            out.writeByte(1);
            out.writeByte(RfbMessages.SECURITY_NONE);
            out.flush();
            int chosen = in.readUnsignedByte();
            FakeRfbServer.serverInit(in, out, 640, 480, version, chosen);
        })) {
            RfbClient client = client(server);
            client.connect();

            assertEquals(RfbMessages.Version.V3_7, client.getVersion());
            assertEquals(480, client.getFramebuffer().getHeight());

            client.disconnect();
            server.await();
        }
    }

    @Test
    void nonRfbServer_isRejected() throws Exception {
        try (FakeRfbServer server = new FakeRfbServer(
                (in, out) -> out.write("HTTP/1.1 400".getBytes(StandardCharsets.US_ASCII)))) {
            RfbClient client = client(server);

            assertThrows(RfbProtocolException.class, client::connect);
            server.await();
        }
    }

    @Test
    void connectionRefused_isPlainIoException() throws Exception {
        InetSocketAddress address;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            address = new InetSocketAddress(InetAddress.getLoopbackAddress(), socket.getLocalPort());
        }
        RfbClient client = new RfbClient(address);

        IOException e = assertThrows(IOException.class, client::connect);
        assertFalse(e instanceof RfbProtocolException);
        assertEquals(RfbClient.State.DISCONNECTED, client.getState());
    }

    @Test
    void versionNegotiation_fallsBackToKnownMinors() throws Exception {
        assertEquals(RfbMessages.Version.V3_8, negotiate("RFB 003.889\n"));
        assertEquals(RfbMessages.Version.V3_7, negotiate("RFB 003.007\n"));
        assertEquals(RfbMessages.Version.V3_3, negotiate("RFB 003.005\n"));
        assertThrows(RfbProtocolException.class, () -> negotiate("RFB 002.000\n"));
    }

    private static RfbMessages.Version negotiate(String version) throws RfbProtocolException {
        return RfbMessages.Version.negotiate(version.getBytes(StandardCharsets.US_ASCII));
    }

    private static RfbClient client(FakeRfbServer server) {
        return new RfbClient(server.address(), Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    private static int countNonBlack(Framebuffer fb) {
        int count = 0;
        for (int y = 0; y < fb.getHeight(); y++) {
            for (int x = 0; x < fb.getWidth(); x++) {
                if (fb.getPixel(x, y) != 0) {
                    count++;
                }
            }
        }
        return count;
    }
}
