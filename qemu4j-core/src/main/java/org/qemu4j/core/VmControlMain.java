package org.qemu4j.core;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point that boots a VM and streams its display until the VM exits or the JVM is
 * interrupted, logging the achieved frame rate.
 * <p>
 * Configuration comes from {@code QEMU4J_*} environment variables, see
 * {@link VmControlConfig#fromEnvironment(java.util.Map)}. An optional first argument
 * overrides {@code QEMU4J_FPS}.
 */
public final class VmControlMain {
    private static final Logger LOG = Logger.getLogger(VmControlMain.class.getName());

    private static final long REPORT_INTERVAL_MS = 5_000;

    private VmControlMain() {
    }

    public static void main(String[] args) throws Exception {
        VmControlConfig config = VmControlConfig.fromEnvironment(System.getenv());
        if (args.length > 0 && args[0] != null && !args[0].isEmpty()) {
            try {
                config = new VmControlConfig(config.getLaunchConfig(), Integer.parseInt(args[0].trim()));
            } catch (IllegalArgumentException e) {
                System.err.println("Invalid fps argument, using " + config.getFps() + ": " + args[0]);
            }
        }

        VmControlPlane plane = new VmControlPlane(config);
        Runtime.getRuntime().addShutdownHook(new Thread(plane::close, "qemu4j-shutdown"));
        if (!plane.start()) {
            System.err.println("QEMU4J FAILED " + plane.getLastError());
            System.exit(1);
        }
        System.err.println("QEMU4J READY qmp=" + plane.supervisor().controlAddress().getPort()
                + " vnc=" + plane.supervisor().displayAddress().getPort()
                + " pid=" + plane.supervisor().processId().orElse(-1));
        System.err.flush();

        AtomicLong frames = new AtomicLong();
        AtomicLong bytes = new AtomicLong();
        DisplayCapture display = plane.display();
        display.setFrameCallback(frame -> {
            frames.incrementAndGet();
            bytes.addAndGet(frame.length);
        });
        display.startStreaming();

        long last = System.nanoTime();
        while (plane.isRunning() && display.isStreaming()) {
            Thread.sleep(REPORT_INTERVAL_MS);
            long now = System.nanoTime();
            long n = frames.getAndSet(0);
            long b = bytes.getAndSet(0);
            double seconds = (now - last) / (double) TimeUnit.SECONDS.toNanos(1);
            last = now;
            LOG.log(Level.INFO, "Streaming {0} fps, {1} KiB/frame", new Object[]{
                    String.format("%.1f", n / seconds), n == 0 ? 0 : b / n / 1024});
        }
        LOG.info("VM exited or display lost, shutting down");
        plane.close();
    }
}
