package org.qemu4j.qmp;

import java.time.Duration;
import java.util.Objects;

/**
 * Hold times and pacing for synthesized input. These match the rate at which the emulated
 * keyboard and tablet process events and are part of the input contract.
 *
 * @param keyHold        hold time of a single key press
 * @param comboHold      hold time of a key combination
 * @param typingDelay    pause between characters when typing text
 * @param clickHold      time between button down and up
 * @param doubleClickGap pause between the two clicks of a double click
 * @param dragSettle     pause after moving to the drag start, before pressing the button
 * @param dragSteps      number of interpolated moves between drag start and end
 * @param dragStepDelay  pause between interpolated drag moves
 */
public record InputTiming(
        Duration keyHold,
        Duration comboHold,
        Duration typingDelay,
        Duration clickHold,
        Duration doubleClickGap,
        Duration dragSettle,
        int dragSteps,
        Duration dragStepDelay) {

    public InputTiming {
        Objects.requireNonNull(keyHold, "keyHold");
        Objects.requireNonNull(comboHold, "comboHold");
        Objects.requireNonNull(typingDelay, "typingDelay");
        Objects.requireNonNull(clickHold, "clickHold");
        Objects.requireNonNull(doubleClickGap, "doubleClickGap");
        Objects.requireNonNull(dragSettle, "dragSettle");
        Objects.requireNonNull(dragStepDelay, "dragStepDelay");
        if (dragSteps < 1) {
            throw new IllegalArgumentException("dragSteps must be at least 1, got " + dragSteps);
        }
    }

    public static InputTiming defaults() {
        return new InputTiming(
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(20),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(50),
                20,
                Duration.ofMillis(10));
    }

    /**
     * No pauses at all; hold times are still sent to QEMU as zero.
     */
    public static InputTiming immediate() {
        return new InputTiming(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO,
                Duration.ZERO, Duration.ZERO, 20, Duration.ZERO);
    }

    public InputTiming withTypingDelay(Duration delay) {
        return new InputTiming(keyHold, comboHold, delay, clickHold, doubleClickGap, dragSettle, dragSteps, dragStepDelay);
    }

    public InputTiming withDragSteps(int steps) {
        return new InputTiming(keyHold, comboHold, typingDelay, clickHold, doubleClickGap, dragSettle, steps, dragStepDelay);
    }
}
