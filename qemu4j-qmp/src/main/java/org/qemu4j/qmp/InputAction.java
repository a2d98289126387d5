package org.qemu4j.qmp;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One input primitive that can be sent to the guest. Each variant is dispatched through
 * {@link Visitor}, so adding a variant forces every visitor to handle it.
 */
public sealed interface InputAction {

    <R> R accept(Visitor<R> visitor) throws IOException, InterruptedException;

    interface Visitor<R> {
        R mouseMove(MouseMove action) throws IOException, InterruptedException;

        R mouseClick(MouseClick action) throws IOException, InterruptedException;

        R mouseDoubleClick(MouseDoubleClick action) throws IOException, InterruptedException;

        R mouseDrag(MouseDrag action) throws IOException, InterruptedException;

        R keyPress(KeyPress action) throws IOException, InterruptedException;

        R keyCombo(KeyCombo action) throws IOException, InterruptedException;

        R typeText(TypeText action) throws IOException, InterruptedException;

        R screenshot(Screenshot action) throws IOException, InterruptedException;
    }

    record MouseMove(int x, int y) implements InputAction {
        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException, InterruptedException {
            return visitor.mouseMove(this);
        }
    }

    record MouseClick(MouseButton button) implements InputAction {
        public MouseClick {
            Objects.requireNonNull(button, "button");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException, InterruptedException {
            return visitor.mouseClick(this);
        }
    }

    record MouseDoubleClick(MouseButton button) implements InputAction {
        public MouseDoubleClick {
            Objects.requireNonNull(button, "button");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException, InterruptedException {
            return visitor.mouseDoubleClick(this);
        }
    }

    record MouseDrag(int startX, int startY, int endX, int endY, MouseButton button) implements InputAction {
        public MouseDrag {
            Objects.requireNonNull(button, "button");
        }

        public MouseDrag(int startX, int startY, int endX, int endY) {
            this(startX, startY, endX, endY, MouseButton.LEFT);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException, InterruptedException {
            return visitor.mouseDrag(this);
        }
    }

    record KeyPress(String key) implements InputAction {
        public KeyPress {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException, InterruptedException {
            return visitor.keyPress(this);
        }
    }

    /**
     * Keys pressed together, in order (e.g. {@code ctrl}, {@code alt}, {@code delete}).
     */
    record KeyCombo(List<String> keys) implements InputAction {
        public KeyCombo {
            keys = List.copyOf(keys);
            if (keys.isEmpty()) {
                throw new IllegalArgumentException("Key combination must not be empty");
            }
        }

        /**
         * Parse a {@code +}-separated combination such as {@code "ctrl+alt+delete"}.
         */
        public static KeyCombo parse(String combo) {
            Objects.requireNonNull(combo, "combo");
            List<String> keys = Arrays.stream(combo.split("\\+"))
                    .map(String::trim)
                    .filter(k -> !k.isEmpty())
                    .collect(Collectors.toList());
            return new KeyCombo(keys);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException, InterruptedException {
            return visitor.keyCombo(this);
        }
    }

    record TypeText(String text) implements InputAction {
        public TypeText {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException, InterruptedException {
            return visitor.typeText(this);
        }
    }

    /**
     * Ask QEMU to dump the display to {@code filename} on the host.
     */
    record Screenshot(String filename) implements InputAction {
        public static final String DEFAULT_FILENAME = "/tmp/screenshot.ppm";

        public Screenshot {
            Objects.requireNonNull(filename, "filename");
        }

        public Screenshot() {
            this(DEFAULT_FILENAME);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) throws IOException, InterruptedException {
            return visitor.screenshot(this);
        }
    }
}
