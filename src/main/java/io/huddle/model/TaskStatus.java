package io.huddle.model;

import java.util.Locale;

/**
 * Task lifecycle. {@code PENDING -> CLAIMED -> DONE | FAILED}; {@code IN_PROGRESS} blocks re-claiming
 * the same way {@code CLAIMED} does. {@code DONE} and {@code FAILED} are terminal.
 */
public enum TaskStatus {
    PENDING,
    CLAIMED,
    IN_PROGRESS,
    DONE,
    FAILED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status must not be blank");
        }
        String v = raw.trim();
        for (TaskStatus value : values()) {
            if (value.name().equalsIgnoreCase(v) || value.wireValue().equalsIgnoreCase(v)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
