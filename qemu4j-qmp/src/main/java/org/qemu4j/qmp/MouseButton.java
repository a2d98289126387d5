package org.qemu4j.qmp;

import java.util.Locale;

/**
 * Pointer buttons as named by QMP {@code input-send-event}.
 */
public enum MouseButton {
    LEFT("left"),
    MIDDLE("middle"),
    RIGHT("right");

    private final String wireName;

    MouseButton(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parse a button name; unknown or null names select {@link #LEFT}.
     */
    public static MouseButton fromName(String name) {
        if (name == null) {
            return LEFT;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "middle":
                return MIDDLE;
            case "right":
                return RIGHT;
            default:
                return LEFT;
        }
    }
}
