package org.qemu4j.process;

/**
 * Fatal emulator launch failure: missing executable, disk image creation failure or
 * early process exit. Not retried by the supervisor.
 */
public class LaunchException extends Exception {

    public LaunchException(String message) {
        super(message);
    }

    public LaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
