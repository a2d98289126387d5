package org.qemu4j.qmp;

import java.util.Locale;
import java.util.Map;

/**
 * Maps symbolic key names to QMP {@code qcode} values.
 * <p>
 * The table is fixed. Lookup is case-insensitive. A name missing from the table is
 * passed through lower-cased: single characters are usually valid qcodes as-is
 * ({@code a}, {@code 7}), and unknown multi-character names are forwarded on a best-effort
 * basis so QEMU can reject them itself.
 */
public final class KeyCodes {

    private static final Map<String, String> QCODES = Map.ofEntries(
            Map.entry("enter", "ret"),
            Map.entry("return", "ret"),
            Map.entry("esc", "esc"),
            Map.entry("escape", "esc"),
            Map.entry("tab", "tab"),
            Map.entry("space", "spc"),
            Map.entry("backspace", "backspace"),
            Map.entry("delete", "delete"),
            Map.entry("del", "delete"),
            Map.entry("insert", "insert"),
            Map.entry("home", "home"),
            Map.entry("end", "end"),
            Map.entry("pageup", "pgup"),
            Map.entry("pagedown", "pgdn"),
            Map.entry("up", "up"),
            Map.entry("down", "down"),
            Map.entry("left", "left"),
            Map.entry("right", "right"),
            Map.entry("f1", "f1"),
            Map.entry("f2", "f2"),
            Map.entry("f3", "f3"),
            Map.entry("f4", "f4"),
            Map.entry("f5", "f5"),
            Map.entry("f6", "f6"),
            Map.entry("f7", "f7"),
            Map.entry("f8", "f8"),
            Map.entry("f9", "f9"),
            Map.entry("f10", "f10"),
            Map.entry("f11", "f11"),
            Map.entry("f12", "f12"),
            Map.entry("ctrl", "ctrl"),
            Map.entry("control", "ctrl"),
            Map.entry("alt", "alt"),
            Map.entry("shift", "shift"),
            Map.entry("super", "meta_l"),
            Map.entry("win", "meta_l"),
            Map.entry("meta", "meta_l"),
            Map.entry("capslock", "caps_lock"),
            Map.entry(".", "dot"),
            Map.entry(",", "comma"),
            Map.entry("/", "slash"),
            Map.entry("\\", "backslash"),
            Map.entry("-", "minus"),
            Map.entry("=", "equal"),
            Map.entry(";", "semicolon"),
            Map.entry("'", "apostrophe"),
            Map.entry("`", "grave_accent"),
            Map.entry("[", "bracket_left"),
            Map.entry("]", "bracket_right"),
            Map.entry("*", "asterisk"));

    private KeyCodes() {
    }

    /**
     * Resolve a key name to its qcode, falling back to the lower-cased name.
     */
    public static String toQcode(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key name must not be empty");
        }
        String lower = key.toLowerCase(Locale.ROOT);
        String mapped = QCODES.get(lower);
        return mapped != null ? mapped : lower;
    }

    /**
     * True if the name is in the fixed table (as opposed to passed through).
     */
    public static boolean isMapped(String key) {
        return key != null && QCODES.containsKey(key.toLowerCase(Locale.ROOT));
    }
}
