package org.qemu4j.qmp;

import java.io.IOException;

/**
 * Abstraction for exchanging newline-delimited text messages (allows tests to script a server).
 */
public interface LineChannel {

    /**
     * Write one message followed by a newline and flush.
     */
    void writeLine(String line) throws IOException;

    /**
     * Read the next line without its terminator; blocks until a line is available.
     *
     * @return the line, or null when the peer closed the connection
     * @throws java.net.SocketTimeoutException if the read timeout elapsed
     */
    String readLine() throws IOException;

    void close();

    boolean isOpen();
}
