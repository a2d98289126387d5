package org.qemu4j.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A running (or exited) emulator process together with the tail of its standard error.
 * <p>
 * A daemon thread drains stderr for the lifetime of the process so the child never
 * blocks on a full pipe; only the last {@code tailLines} lines are kept.
 */
public final class EmulatorProcess {
    private static final Logger LOG = Logger.getLogger(EmulatorProcess.class.getName());
    static final int DEFAULT_TAIL_LINES = 50;

    private final Process process;
    private final List<String> command;
    private final ArrayDeque<String> stderrTail = new ArrayDeque<>();
    private final int tailLines;
    private final Thread stderrReader;

    EmulatorProcess(Process process, List<String> command) {
        this(process, command, DEFAULT_TAIL_LINES);
    }

    EmulatorProcess(Process process, List<String> command, int tailLines) {
        this.process = Objects.requireNonNull(process, "process");
        this.command = List.copyOf(command);
        this.tailLines = Math.max(1, tailLines);
        this.stderrReader = new Thread(this::drainStderr, "qemu4j-stderr-" + process.pid());
        this.stderrReader.setDaemon(true);
        this.stderrReader.start();
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Exit code, empty while the process is still running.
     */
    public OptionalInt exitCode() {
        if (process.isAlive()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(process.exitValue());
    }

    public List<String> command() {
        return command;
    }

    /**
     * Snapshot of the captured standard-error tail, oldest line first.
     */
    public List<String> stderrTail() {
        synchronized (stderrTail) {
            return new ArrayList<>(stderrTail);
        }
    }

    /**
     * Waits until the stderr pipe has been fully drained (the process closed it) or the
     * timeout elapses. Used after an early exit so the diagnostic includes the last lines.
     */
    void awaitStderrDrained(long timeoutMs) {
        try {
            stderrReader.join(Math.max(1, timeoutMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    boolean waitFor(long timeoutMs) throws InterruptedException {
        return process.waitFor(Math.max(0, timeoutMs), TimeUnit.MILLISECONDS);
    }

    void waitFor() throws InterruptedException {
        process.waitFor();
    }

    void terminate() {
        process.destroy();
    }

    void kill() {
        process.destroyForcibly();
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (stderrTail) {
                    if (stderrTail.size() == tailLines) {
                        stderrTail.removeFirst();
                    }
                    stderrTail.addLast(line);
                }
                LOG.log(Level.FINE, "qemu[{0}] {1}", new Object[]{process.pid(), line});
            }
        } catch (IOException e) {
            LOG.log(Level.FINE, "stderr reader stopped", e);
        }
    }
}
