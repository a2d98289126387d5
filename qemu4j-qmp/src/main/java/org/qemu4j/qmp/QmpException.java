package org.qemu4j.qmp;

import java.io.IOException;

/**
 * QMP protocol failure that does not by itself mean the connection is dead
 * (malformed message, unexpected greeting, reply timeout).
 */
public class QmpException extends IOException {

    public QmpException(String message) {
        super(message);
    }

    public QmpException(String message, Throwable cause) {
        super(message, cause);
    }
}
