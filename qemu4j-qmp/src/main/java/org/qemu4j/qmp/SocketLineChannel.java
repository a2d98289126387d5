package org.qemu4j.qmp;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TCP implementation of {@link LineChannel}.
 */
public final class SocketLineChannel implements LineChannel {
    private static final Logger LOG = Logger.getLogger(SocketLineChannel.class.getName());

    private final Socket socket;
    private final BufferedReader reader;
    private final BufferedWriter writer;
    private final AtomicBoolean open = new AtomicBoolean(true);

    public SocketLineChannel(Socket socket) throws IOException {
        this.socket = socket;
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    /**
     * Open a TCP connection.
     *
     * @param connectTimeoutMillis connect timeout
     * @param readTimeoutMillis    read timeout applied to every {@link #readLine()}; 0 blocks forever
     * @throws java.net.ConnectException if nothing is listening yet
     */
    public static SocketLineChannel connect(InetSocketAddress address, int connectTimeoutMillis,
                                            int readTimeoutMillis) throws IOException {
        Socket socket = new Socket();
        try {
            socket.connect(address, Math.max(0, connectTimeoutMillis));
            socket.setSoTimeout(Math.max(0, readTimeoutMillis));
            socket.setTcpNoDelay(true);
            return new SocketLineChannel(socket);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    @Override
    public void writeLine(String line) throws IOException {
        if (!open.get()) {
            throw new IOException("Channel closed");
        }
        writer.write(line);
        writer.write('\n');
        writer.flush();
    }

    @Override
    public String readLine() throws IOException {
        if (!open.get()) {
            throw new IOException("Channel closed");
        }
        return reader.readLine();
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            try {
                socket.close();
            } catch (IOException e) {
                LOG.log(Level.FINE, "Error closing QMP socket", e);
            }
        }
    }

    @Override
    public boolean isOpen() {
        return open.get() && !socket.isClosed();
    }
}
