package org.qemu4j.core;

import org.qemu4j.process.LaunchConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Launch configuration plus display streaming settings for a {@link VmControlPlane}.
 * <p>
 * {@link #fromEnvironment(Map)} reads:
 * <ul>
 *   <li>{@code QEMU4J_ISO}, {@code QEMU4J_DISK}, {@code QEMU4J_DISK_SIZE}: boot media, disk image and its size</li>
 *   <li>{@code QEMU4J_MEMORY}, {@code QEMU4J_CPUS}: guest memory in MiB and CPU count</li>
 *   <li>{@code QEMU4J_QMP_PORT}, {@code QEMU4J_VNC_PORT}: control and display ports</li>
 *   <li>{@code QEMU4J_WIDTH}, {@code QEMU4J_HEIGHT}: guest resolution, also the capture size</li>
 *   <li>{@code QEMU4J_FPS}: streaming frame rate</li>
 *   <li>{@code QEMU4J_KVM}: {@code 0} or {@code false} disables KVM</li>
 * </ul>
 * Unset variables keep their defaults; invalid values are logged and ignored.
 */
public final class VmControlConfig {
    private static final Logger LOG = Logger.getLogger(VmControlConfig.class.getName());

    static final int MAX_FPS = 120;
    private static final int MAX_DIMENSION = 8192;

    private final LaunchConfig launchConfig;
    private final int fps;

    public VmControlConfig(LaunchConfig launchConfig, int fps) {
        if (fps <= 0 || fps > MAX_FPS) {
            throw new IllegalArgumentException("fps must be in 1-" + MAX_FPS + ", got " + fps);
        }
        this.launchConfig = Objects.requireNonNull(launchConfig, "launchConfig");
        this.fps = fps;
    }

    public static VmControlConfig defaults() {
        return new VmControlConfig(LaunchConfig.builder().build(), DisplayCapture.DEFAULT_FPS);
    }

    public static VmControlConfig fromEnvironment(Map<String, String> env) {
        LaunchConfig defaults = LaunchConfig.builder().build();
        LaunchConfig.Builder b = defaults.toBuilder();

        Path iso = path(env, "QEMU4J_ISO");
        if (iso != null) {
            b.bootMedia(iso);
        }
        Path disk = path(env, "QEMU4J_DISK");
        if (disk != null) {
            b.diskPath(disk);
        }
        String diskSize = text(env, "QEMU4J_DISK_SIZE");
        if (diskSize != null) {
            if (diskSize.matches("\\d+[KMGT]?")) {
                b.diskSize(diskSize);
            } else {
                invalid("QEMU4J_DISK_SIZE", diskSize, defaults.getDiskSize());
            }
        }
        String memory = text(env, "QEMU4J_MEMORY");
        if (memory != null) {
            if (memory.matches("\\d+[MG]?")) {
                b.memory(memory);
            } else {
                invalid("QEMU4J_MEMORY", memory, defaults.getMemory());
            }
        }
        b.cpus(integer(env, "QEMU4J_CPUS", defaults.getCpus(), 1, 512));
        int qmpPort = integer(env, "QEMU4J_QMP_PORT", defaults.getQmpPort(), 1, 65535);
        int vncPort = integer(env, "QEMU4J_VNC_PORT", defaults.getVncPort(), 5900, 65535);
        if (qmpPort == vncPort) {
            LOG.log(Level.WARNING, "QEMU4J_QMP_PORT equals QEMU4J_VNC_PORT ({0}), using default ports",
                    String.valueOf(qmpPort));
            qmpPort = defaults.getQmpPort();
            vncPort = defaults.getVncPort();
        }
        b.qmpPort(qmpPort).vncPort(vncPort);
        b.display(integer(env, "QEMU4J_WIDTH", defaults.getDisplayWidth(), 1, MAX_DIMENSION),
                integer(env, "QEMU4J_HEIGHT", defaults.getDisplayHeight(), 1, MAX_DIMENSION));
        String kvm = text(env, "QEMU4J_KVM");
        if (kvm != null) {
            b.enableKvm(!("0".equals(kvm) || "false".equals(kvm.toLowerCase(Locale.ROOT))));
        }
        int fps = integer(env, "QEMU4J_FPS", DisplayCapture.DEFAULT_FPS, 1, MAX_FPS);
        return new VmControlConfig(b.build(), fps);
    }

    public LaunchConfig getLaunchConfig() {
        return launchConfig;
    }

    public int getFps() {
        return fps;
    }

    public int getCaptureWidth() {
        return launchConfig.getDisplayWidth();
    }

    public int getCaptureHeight() {
        return launchConfig.getDisplayHeight();
    }

    @Override
    public String toString() {
        return "VmControlConfig{qmpPort=" + launchConfig.getQmpPort()
                + ", vncPort=" + launchConfig.getVncPort()
                + ", display=" + getCaptureWidth() + "x" + getCaptureHeight()
                + ", fps=" + fps + '}';
    }

    private static String text(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    private static Path path(Map<String, String> env, String key) {
        String value = text(env, key);
        return value == null ? null : Paths.get(value);
    }

    private static int integer(Map<String, String> env, String key, int defaultValue, int min, int max) {
        String value = text(env, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value);
            if (parsed >= min && parsed <= max) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            LOG.log(Level.FINE, "Not a number: " + key + "=" + value, e);
        }
        invalid(key, value, String.valueOf(defaultValue));
        return defaultValue;
    }

    private static void invalid(String key, String value, String fallback) {
        LOG.log(Level.WARNING, "Invalid {0}={1}, using default {2}", new Object[]{key, value, fallback});
    }
}
