package org.qemu4j.rfb;

import java.io.IOException;

/**
 * The display server sent something this client cannot accept: a malformed handshake
 * field, a refused or failed security handshake, or a message whose length cannot be
 * determined. The connection is closed when this is thrown.
 */
public class RfbProtocolException extends IOException {

    public RfbProtocolException(String message) {
        super(message);
    }

    public RfbProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
