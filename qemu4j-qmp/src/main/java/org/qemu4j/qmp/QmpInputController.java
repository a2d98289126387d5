package org.qemu4j.qmp;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keyboard and mouse primitives built on {@link QmpClient#execute}.
 * <p>
 * Keys go through {@code send-key} with a hold time; pointer input goes through
 * {@code input-send-event} with absolute coordinates. Pauses between steps come from
 * {@link InputTiming}.
 */
public class QmpInputController {
    private static final Logger LOG = Logger.getLogger(QmpInputController.class.getName());

    private final QmpClient client;
    private final InputTiming timing;
    private final Dispatcher dispatcher = new Dispatcher();

    public QmpInputController(QmpClient client) {
        this(client, InputTiming.defaults());
    }

    public QmpInputController(QmpClient client, InputTiming timing) {
        this.client = Objects.requireNonNull(client, "client");
        this.timing = Objects.requireNonNull(timing, "timing");
    }

    /**
     * Perform one input action.
     *
     * @return the screenshot path for {@link InputAction.Screenshot}, otherwise null
     */
    public String perform(InputAction action) throws IOException, InterruptedException {
        LOG.log(Level.FINE, "Performing {0}", action);
        return action.accept(dispatcher);
    }

    public void mouseMove(int x, int y) throws IOException {
        client.execute("input-send-event", Map.of("events", List.of(
                Map.of("type", "abs", "data", Map.of("axis", "x", "value", x)),
                Map.of("type", "abs", "data", Map.of("axis", "y", "value", y)))));
    }

    public void mouseClick(MouseButton button) throws IOException, InterruptedException {
        sendButton(button, true);
        pause(timing.clickHold());
        sendButton(button, false);
    }

    public void mouseDoubleClick(MouseButton button) throws IOException, InterruptedException {
        mouseClick(button);
        pause(timing.doubleClickGap());
        mouseClick(button);
    }

    /**
     * Press at the start point, move in {@link InputTiming#dragSteps()} linear steps to the
     * end point, then release.
     */
    public void mouseDrag(int startX, int startY, int endX, int endY, MouseButton button)
            throws IOException, InterruptedException {
        mouseMove(startX, startY);
        pause(timing.dragSettle());
        sendButton(button, true);
        int steps = timing.dragSteps();
        for (int i = 1; i <= steps; i++) {
            int x = startX + Math.floorDiv((endX - startX) * i, steps);
            int y = startY + Math.floorDiv((endY - startY) * i, steps);
            mouseMove(x, y);
            pause(timing.dragStepDelay());
        }
        sendButton(button, false);
    }

    public void keyPress(String key) throws IOException {
        sendKeys(List.of(KeyCodes.toQcode(key)), timing.keyHold());
    }

    /**
     * Press all keys together, in the given order.
     */
    public void keyCombo(List<String> keys) throws IOException {
        List<String> qcodes = new ArrayList<>(keys.size());
        for (String key : keys) {
            qcodes.add(KeyCodes.toQcode(key));
        }
        sendKeys(qcodes, timing.comboHold());
    }

    /**
     * Type text one character at a time. Space, newline and tab use their key names,
     * upper-case letters are sent as shift plus the lower-case letter, everything else
     * as a literal key.
     */
    public void typeText(String text) throws IOException, InterruptedException {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ' ') {
                keyPress("space");
            } else if (c == '\n') {
                keyPress("enter");
            } else if (c == '\t') {
                keyPress("tab");
            } else if (Character.isUpperCase(c)) {
                keyCombo(List.of("shift", String.valueOf(c).toLowerCase(Locale.ROOT)));
            } else {
                keyPress(String.valueOf(c));
            }
            pause(timing.typingDelay());
        }
    }

    /**
     * Ask QEMU to write the current display to a file on the host.
     *
     * @return the file name passed to QEMU
     */
    public String screenshot(String filename) throws IOException {
        client.execute("screendump", Map.of("filename", filename));
        return filename;
    }

    public InputTiming getTiming() {
        return timing;
    }

    private void sendButton(MouseButton button, boolean down) throws IOException {
        client.execute("input-send-event", Map.of("events", List.of(
                Map.of("type", "btn", "data", Map.of("down", down, "button", button.wireName())))));
    }

    private void sendKeys(List<String> qcodes, Duration hold) throws IOException {
        List<Map<String, String>> keys = new ArrayList<>(qcodes.size());
        for (String qcode : qcodes) {
            keys.add(Map.of("type", "qcode", "data", qcode));
        }
        client.execute("send-key", Map.of("keys", keys, "hold-time", hold.toMillis()));
    }

    private static void pause(Duration duration) throws InterruptedException {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    }

    private final class Dispatcher implements InputAction.Visitor<String> {
        @Override
        public String mouseMove(InputAction.MouseMove action) throws IOException {
            QmpInputController.this.mouseMove(action.x(), action.y());
            return null;
        }

        @Override
        public String mouseClick(InputAction.MouseClick action) throws IOException, InterruptedException {
            QmpInputController.this.mouseClick(action.button());
            return null;
        }

        @Override
        public String mouseDoubleClick(InputAction.MouseDoubleClick action) throws IOException, InterruptedException {
            QmpInputController.this.mouseDoubleClick(action.button());
            return null;
        }

        @Override
        public String mouseDrag(InputAction.MouseDrag action) throws IOException, InterruptedException {
            QmpInputController.this.mouseDrag(action.startX(), action.startY(), action.endX(), action.endY(),
                    action.button());
            return null;
        }

        @Override
        public String keyPress(InputAction.KeyPress action) throws IOException {
            QmpInputController.this.keyPress(action.key());
            return null;
        }

        @Override
        public String keyCombo(InputAction.KeyCombo action) throws IOException {
            QmpInputController.this.keyCombo(action.keys());
            return null;
        }

        @Override
        public String typeText(InputAction.TypeText action) throws IOException, InterruptedException {
            QmpInputController.this.typeText(action.text());
            return null;
        }

        @Override
        public String screenshot(InputAction.Screenshot action) throws IOException {
            return QmpInputController.this.screenshot(action.filename());
        }
    }
}
