package org.qemu4j.core;

import org.qemu4j.process.QemuSupervisor;
import org.qemu4j.qmp.InputAction;
import org.qemu4j.qmp.QmpClient;
import org.qemu4j.qmp.QmpInputController;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One virtual machine: the emulator process, its QMP control connection and its VNC
 * display, started and stopped together.
 */
public class VmControlPlane implements Closeable {
    private static final Logger LOG = Logger.getLogger(VmControlPlane.class.getName());

    private final QemuSupervisor supervisor;
    private final QmpClient control;
    private final QmpInputController input;
    private final DisplayCapture display;
    private volatile String lastError;

    public VmControlPlane(VmControlConfig config) {
        this(new QemuSupervisor(config.getLaunchConfig()), config);
    }

    private VmControlPlane(QemuSupervisor supervisor, VmControlConfig config) {
        this(supervisor, new QmpClient(supervisor.controlAddress()),
                new DisplayCapture(supervisor.displayAddress(), config.getCaptureWidth(), config.getCaptureHeight(),
                        config.getFps()));
    }

    public VmControlPlane(QemuSupervisor supervisor, QmpClient control, DisplayCapture display) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.control = Objects.requireNonNull(control, "control");
        this.display = Objects.requireNonNull(display, "display");
        this.input = new QmpInputController(control);
    }

    /**
     * Launch the emulator, then connect QMP and the display, each with its own retry
     * policy. Anything already started is torn down again on failure.
     *
     * @return true when all three are up; otherwise {@link #getLastError()} says why
     */
    public boolean start() {
        lastError = null;
        if (!supervisor.start()) {
            lastError = "QEMU failed to start: " + supervisor.getLastError();
            return false;
        }
        if (!control.connect()) {
            return abort("Could not connect to QMP at " + supervisor.controlAddress());
        }
        if (!display.connect()) {
            return abort("Could not connect to VNC at " + supervisor.displayAddress());
        }
        LOG.info("VM control plane ready");
        return true;
    }

    /**
     * Send one input action to the guest.
     *
     * @return the screenshot path for a screenshot action, otherwise null
     */
    public String perform(InputAction action) throws IOException, InterruptedException {
        return input.perform(action);
    }

    public boolean isRunning() {
        return supervisor.isRunning();
    }

    /**
     * Disconnect both protocol clients and stop the emulator. Idempotent.
     */
    @Override
    public void close() {
        display.disconnect();
        control.disconnect();
        supervisor.stop(false);
    }

    public String getLastError() {
        return lastError;
    }

    public QemuSupervisor supervisor() {
        return supervisor;
    }

    public QmpClient control() {
        return control;
    }

    public QmpInputController input() {
        return input;
    }

    public DisplayCapture display() {
        return display;
    }

    private boolean abort(String message) {
        lastError = message;
        LOG.log(Level.SEVERE, message);
        close();
        return false;
    }
}
