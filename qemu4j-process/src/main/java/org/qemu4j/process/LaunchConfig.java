package org.qemu4j.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable launch configuration for one emulator session.
 * <p>
 * The VNC port maps to a QEMU display number ({@code port - 5900}), so ports below
 * 5900 are rejected. Audio wiring is skipped when {@link #getAudioBackend()} is null.
 */
public final class LaunchConfig {

    public static final int VNC_BASE_PORT = 5900;

    private final Path emulatorBinary;
    private final Path bootMedia;
    private final Path diskPath;
    private final String diskSize;
    private final String memory;
    private final int cpus;
    private final int displayWidth;
    private final int displayHeight;
    private final int qmpPort;
    private final int vncPort;
    private final boolean enableKvm;
    private final String audioBackend;
    private final List<String> extraArgs;
    private final Duration livenessWindow;
    private final Duration stopTimeout;
    private final String diskImageTool;

    private LaunchConfig(Builder b) {
        this.emulatorBinary = b.emulatorBinary;
        this.bootMedia = b.bootMedia;
        this.diskPath = b.diskPath;
        this.diskSize = b.diskSize;
        this.memory = b.memory;
        this.cpus = b.cpus;
        this.displayWidth = b.displayWidth;
        this.displayHeight = b.displayHeight;
        this.qmpPort = b.qmpPort;
        this.vncPort = b.vncPort;
        this.enableKvm = b.enableKvm;
        this.audioBackend = b.audioBackend;
        this.extraArgs = Collections.unmodifiableList(new ArrayList<>(b.extraArgs));
        this.livenessWindow = b.livenessWindow;
        this.stopTimeout = b.stopTimeout;
        this.diskImageTool = b.diskImageTool;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Explicit emulator binary, or null to search {@code PATH}.
     */
    public Path getEmulatorBinary() {
        return emulatorBinary;
    }

    public Path getBootMedia() {
        return bootMedia;
    }

    public Path getDiskPath() {
        return diskPath;
    }

    public String getDiskSize() {
        return diskSize;
    }

    public String getMemory() {
        return memory;
    }

    public int getCpus() {
        return cpus;
    }

    public int getDisplayWidth() {
        return displayWidth;
    }

    public int getDisplayHeight() {
        return displayHeight;
    }

    public int getQmpPort() {
        return qmpPort;
    }

    public int getVncPort() {
        return vncPort;
    }

    public int getVncDisplay() {
        return vncPort - VNC_BASE_PORT;
    }

    public boolean isEnableKvm() {
        return enableKvm;
    }

    public String getAudioBackend() {
        return audioBackend;
    }

    public List<String> getExtraArgs() {
        return extraArgs;
    }

    public Duration getLivenessWindow() {
        return livenessWindow;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public String getDiskImageTool() {
        return diskImageTool;
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.emulatorBinary = emulatorBinary;
        b.bootMedia = bootMedia;
        b.diskPath = diskPath;
        b.diskSize = diskSize;
        b.memory = memory;
        b.cpus = cpus;
        b.displayWidth = displayWidth;
        b.displayHeight = displayHeight;
        b.qmpPort = qmpPort;
        b.vncPort = vncPort;
        b.enableKvm = enableKvm;
        b.audioBackend = audioBackend;
        b.extraArgs = new ArrayList<>(extraArgs);
        b.livenessWindow = livenessWindow;
        b.stopTimeout = stopTimeout;
        b.diskImageTool = diskImageTool;
        return b;
    }

    public static final class Builder {
        private Path emulatorBinary;
        private Path bootMedia;
        private Path diskPath;
        private String diskSize = "20G";
        private String memory = "4096";
        private int cpus = 2;
        private int displayWidth = 1920;
        private int displayHeight = 1080;
        private int qmpPort = 4444;
        private int vncPort = VNC_BASE_PORT;
        private boolean enableKvm = true;
        private String audioBackend = "pa";
        private List<String> extraArgs = new ArrayList<>();
        private Duration livenessWindow = Duration.ofSeconds(2);
        private Duration stopTimeout = Duration.ofSeconds(10);
        private String diskImageTool = "qemu-img";

        private Builder() {
        }

        public Builder emulatorBinary(Path emulatorBinary) {
            this.emulatorBinary = emulatorBinary;
            return this;
        }

        public Builder bootMedia(Path bootMedia) {
            this.bootMedia = bootMedia;
            return this;
        }

        public Builder diskPath(Path diskPath) {
            this.diskPath = diskPath;
            return this;
        }

        public Builder diskSize(String diskSize) {
            this.diskSize = Objects.requireNonNull(diskSize, "diskSize");
            return this;
        }

        public Builder memory(String memory) {
            this.memory = Objects.requireNonNull(memory, "memory");
            return this;
        }

        public Builder cpus(int cpus) {
            this.cpus = cpus;
            return this;
        }

        public Builder display(int width, int height) {
            this.displayWidth = width;
            this.displayHeight = height;
            return this;
        }

        public Builder qmpPort(int qmpPort) {
            this.qmpPort = qmpPort;
            return this;
        }

        public Builder vncPort(int vncPort) {
            this.vncPort = vncPort;
            return this;
        }

        public Builder enableKvm(boolean enableKvm) {
            this.enableKvm = enableKvm;
            return this;
        }

        /**
         * QEMU audiodev backend ({@code pa}, {@code alsa}, {@code none}...); null omits audio devices.
         */
        public Builder audioBackend(String audioBackend) {
            this.audioBackend = audioBackend;
            return this;
        }

        public Builder extraArgs(List<String> extraArgs) {
            this.extraArgs = new ArrayList<>(Objects.requireNonNull(extraArgs, "extraArgs"));
            return this;
        }

        public Builder addExtraArg(String arg) {
            this.extraArgs.add(Objects.requireNonNull(arg, "arg"));
            return this;
        }

        public Builder livenessWindow(Duration livenessWindow) {
            this.livenessWindow = Objects.requireNonNull(livenessWindow, "livenessWindow");
            return this;
        }

        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
            return this;
        }

        public Builder diskImageTool(String diskImageTool) {
            this.diskImageTool = Objects.requireNonNull(diskImageTool, "diskImageTool");
            return this;
        }

        /**
         * @throws IllegalArgumentException if a port, CPU count or resolution is out of range
         */
        public LaunchConfig build() {
            checkPort("qmpPort", qmpPort);
            checkPort("vncPort", vncPort);
            if (vncPort < VNC_BASE_PORT) {
                throw new IllegalArgumentException("vncPort must be >= " + VNC_BASE_PORT + ", got " + vncPort);
            }
            if (qmpPort == vncPort) {
                throw new IllegalArgumentException("qmpPort and vncPort must differ, both are " + qmpPort);
            }
            if (cpus <= 0) {
                throw new IllegalArgumentException("cpus must be positive, got " + cpus);
            }
            if (displayWidth <= 0 || displayHeight <= 0) {
                throw new IllegalArgumentException(
                        "Display resolution must be positive, got " + displayWidth + "x" + displayHeight);
            }
            if (livenessWindow.isNegative() || stopTimeout.isNegative()) {
                throw new IllegalArgumentException("Timeouts must not be negative");
            }
            return new LaunchConfig(this);
        }

        private static void checkPort(String name, int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException(name + " out of range 1-65535: " + port);
            }
        }
    }
}
