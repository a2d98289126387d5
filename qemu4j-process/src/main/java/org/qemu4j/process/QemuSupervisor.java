package org.qemu4j.process;

import java.io.File;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Launches and supervises a single QEMU process.
 * <p>
 * {@link #start(LaunchConfig)} locates the emulator, creates the disk image when it does
 * not exist, spawns QEMU and verifies it survives a short liveness window.
 * {@link #stop(boolean)} sends SIGTERM, escalates to SIGKILL after the configured timeout
 * and always waits for the process to exit. A process that dies later is not polled for;
 * the protocol clients notice it through their connections.
 */
public class QemuSupervisor {
    private static final Logger LOG = Logger.getLogger(QemuSupervisor.class.getName());

    static final List<String> EMULATOR_NAMES = List.of("qemu-system-x86_64", "kvm", "qemu-kvm");
    private static final long DISK_CREATE_TIMEOUT_MS = 60_000;
    private static final long STDERR_DRAIN_MS = 500;

    private final Map<String, String> environment;
    private final Path kvmDevice;
    private final Duration diskCreateTimeout;

    private volatile LaunchConfig config;
    private volatile EmulatorProcess process;
    private volatile String lastError;

    public QemuSupervisor(LaunchConfig config) {
        this(config, System.getenv(), Paths.get("/dev/kvm"));
    }

    QemuSupervisor(LaunchConfig config, Map<String, String> environment, Path kvmDevice) {
        this(config, environment, kvmDevice, Duration.ofMillis(DISK_CREATE_TIMEOUT_MS));
    }

    QemuSupervisor(LaunchConfig config, Map<String, String> environment, Path kvmDevice, Duration diskCreateTimeout) {
        this.config = Objects.requireNonNull(config, "config");
        this.environment = Map.copyOf(environment);
        this.kvmDevice = kvmDevice;
        this.diskCreateTimeout = Objects.requireNonNull(diskCreateTimeout, "diskCreateTimeout");
    }

    /**
     * Start the emulator with the configuration given at construction time.
     */
    public boolean start() {
        return start(config);
    }

    /**
     * Start the emulator. Calling this while a process is running is a no-op that
     * returns true; the running session keeps its original configuration.
     *
     * @return true if the process is running after the liveness window; on false,
     * {@link #getLastError()} holds the diagnostic
     */
    public synchronized boolean start(LaunchConfig launchConfig) {
        Objects.requireNonNull(launchConfig, "launchConfig");
        EmulatorProcess current = process;
        if (current != null && current.isAlive()) {
            LOG.warning("VM is already running");
            return true;
        }
        this.config = launchConfig;
        this.lastError = null;
        try {
            List<String> command = buildCommand();
            LOG.log(Level.INFO, "Starting QEMU: {0}", String.join(" ", command));
            EmulatorProcess started = spawn(command);
            if (started.waitFor(launchConfig.getLivenessWindow().toMillis())) {
                started.awaitStderrDrained(STDERR_DRAIN_MS);
                throw new LaunchException("QEMU exited during startup with code "
                        + started.exitCode().orElse(-1) + ": " + String.join("\n", started.stderrTail()));
            }
            process = started;
            LOG.log(Level.INFO, "QEMU started with PID {0}", started.pid());
            return true;
        } catch (LaunchException e) {
            return fail(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fail("Interrupted while starting QEMU", e);
        }
    }

    /**
     * Stop the emulator. Sends SIGTERM unless {@code force} is set, waits up to the
     * configured stop timeout, then kills. Returns only once the process has exited.
     * Does nothing if no process is running.
     */
    public synchronized void stop(boolean force) {
        EmulatorProcess current = process;
        if (current == null) {
            return;
        }
        boolean interrupted = false;
        if (force) {
            current.kill();
        } else {
            current.terminate();
        }
        try {
            if (!current.waitFor(config.getStopTimeout().toMillis())) {
                LOG.log(Level.WARNING, "QEMU did not exit within {0} ms, killing",
                        config.getStopTimeout().toMillis());
                current.kill();
            }
        } catch (InterruptedException e) {
            interrupted = true;
            current.kill();
        }
        while (true) {
            try {
                current.waitFor();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        process = null;
        LOG.log(Level.INFO, "QEMU stopped (PID {0})", current.pid());
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Block until the emulator exits on its own or the timeout elapses.
     *
     * @return true if no process is running when this returns
     */
    public boolean waitForExit(Duration timeout) throws InterruptedException {
        EmulatorProcess current = process;
        return current == null || current.waitFor(timeout.toMillis());
    }

    public boolean isRunning() {
        EmulatorProcess current = process;
        return current != null && current.isAlive();
    }

    public OptionalLong processId() {
        EmulatorProcess current = process;
        return current == null ? OptionalLong.empty() : OptionalLong.of(current.pid());
    }

    public Optional<EmulatorProcess> currentProcess() {
        return Optional.ofNullable(process);
    }

    public InetSocketAddress controlAddress() {
        return new InetSocketAddress("localhost", config.getQmpPort());
    }

    public InetSocketAddress displayAddress() {
        return new InetSocketAddress("localhost", config.getVncPort());
    }

    public LaunchConfig getConfig() {
        return config;
    }

    /**
     * Diagnostic of the last failed {@link #start}, or null.
     */
    public String getLastError() {
        return lastError;
    }

    /**
     * Assemble the emulator argument vector. Creates the disk image as a side effect
     * when the configured disk path does not exist yet.
     */
    public List<String> buildCommand() throws LaunchException {
        LaunchConfig cfg = config;
        List<String> cmd = new ArrayList<>();
        cmd.add(locateEmulator(cfg).toString());

        if (cfg.isEnableKvm() && kvmDevice != null && Files.exists(kvmDevice)) {
            cmd.add("-enable-kvm");
        }
        cmd.add("-m");
        cmd.add(cfg.getMemory());
        cmd.add("-smp");
        cmd.add(String.valueOf(cfg.getCpus()));

        Path disk = cfg.getDiskPath();
        if (disk != null) {
            if (!Files.exists(disk)) {
                createDisk(cfg, disk);
            }
            cmd.add("-hda");
            cmd.add(disk.toString());
        }
        Path media = cfg.getBootMedia();
        if (media != null && Files.exists(media)) {
            cmd.add("-cdrom");
            cmd.add(media.toString());
            if (disk == null) {
                cmd.add("-boot");
                cmd.add("d");
            }
        }

        cmd.add("-vnc");
        cmd.add(":" + cfg.getVncDisplay());
        cmd.add("-qmp");
        cmd.add("tcp:localhost:" + cfg.getQmpPort() + ",server,nowait");

        cmd.add("-device");
        cmd.add("virtio-vga,xres=" + cfg.getDisplayWidth() + ",yres=" + cfg.getDisplayHeight());
        cmd.add("-device");
        cmd.add("virtio-keyboard-pci");
        cmd.add("-device");
        cmd.add("virtio-mouse-pci");
        cmd.add("-device");
        cmd.add("virtio-net-pci,netdev=net0");
        cmd.add("-netdev");
        cmd.add("user,id=net0");
        cmd.add("-usb");
        cmd.add("-device");
        cmd.add("usb-tablet");

        if (cfg.getAudioBackend() != null) {
            cmd.add("-audiodev");
            cmd.add(cfg.getAudioBackend() + ",id=audio0");
            cmd.add("-device");
            cmd.add("intel-hda");
            cmd.add("-device");
            cmd.add("hda-duplex,audiodev=audio0");
        }

        cmd.addAll(cfg.getExtraArgs());
        return cmd;
    }

    private EmulatorProcess spawn(List<String> command) throws LaunchException {
        try {
            Process p = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectInput(ProcessBuilder.Redirect.PIPE)
                    .start();
            return new EmulatorProcess(p, command);
        } catch (IOException e) {
            throw new LaunchException("Failed to spawn " + command.get(0) + ": " + e.getMessage(), e);
        }
    }

    private Path locateEmulator(LaunchConfig cfg) throws LaunchException {
        Path explicit = cfg.getEmulatorBinary();
        if (explicit != null) {
            return resolveExecutable(explicit.toString())
                    .orElseThrow(() -> new LaunchException("QEMU binary not found or not executable: " + explicit));
        }
        for (String name : EMULATOR_NAMES) {
            Optional<Path> found = resolveExecutable(name);
            if (found.isPresent()) {
                return found.get();
            }
        }
        throw new LaunchException("QEMU not found. Please install qemu-system-x86_64");
    }

    private void createDisk(LaunchConfig cfg, Path disk) throws LaunchException {
        Path tool = resolveExecutable(cfg.getDiskImageTool())
                .orElseThrow(() -> new LaunchException(cfg.getDiskImageTool() + " not found"));
        List<String> cmd = List.of(tool.toString(), "create", "-f", "qcow2", disk.toString(), cfg.getDiskSize());
        Path log = null;
        try {
            Path parent = disk.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            log = Files.createTempFile("qemu4j-img", ".log");
            Process p = new ProcessBuilder(cmd)
                    .redirectErrorStream(true)
                    .redirectOutput(log.toFile())
                    .start();
            if (!p.waitFor(diskCreateTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new LaunchException("Disk image creation timed out after "
                        + diskCreateTimeout.toMillis() + " ms: " + disk);
            }
            if (p.exitValue() != 0) {
                String output = Files.readString(log, StandardCharsets.UTF_8);
                throw new LaunchException("Disk image creation failed (exit " + p.exitValue() + "): " + output.trim());
            }
            LOG.log(Level.INFO, "Created disk image: {0} ({1})", new Object[]{disk, cfg.getDiskSize()});
        } catch (IOException e) {
            throw new LaunchException("Disk image creation failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LaunchException("Interrupted while creating disk image " + disk, e);
        } finally {
            deleteQuietly(log);
        }
    }

    /**
     * A name containing a path separator is checked directly; a bare name is searched on PATH.
     */
    Optional<Path> resolveExecutable(String name) {
        if (name.indexOf('/') >= 0 || name.indexOf(File.separatorChar) >= 0) {
            Path p = Paths.get(name);
            return Files.isRegularFile(p) && Files.isExecutable(p) ? Optional.of(p) : Optional.empty();
        }
        String path = environment.get("PATH");
        if (path == null || path.isEmpty()) {
            return Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate = Paths.get(dir, name);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private boolean fail(String message, Throwable cause) {
        lastError = message;
        LOG.log(Level.SEVERE, "Failed to start QEMU: " + message, cause);
        return false;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.log(Level.FINE, "Could not delete " + file, e);
        }
    }
}
