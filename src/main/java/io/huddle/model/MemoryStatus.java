package io.huddle.model;

import java.util.Locale;

/**
 * Lifecycle of a project memory entry. Entries are never deleted; moving away from
 * {@code ACTIVE} hides them from recall.
 */
public enum MemoryStatus {
    ACTIVE,
    RESOLVED,
    DEPRECATED,
    SUPERSEDED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MemoryStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Memory status must not be blank");
        }
        for (MemoryStatus value : values()) {
            if (value.wireValue().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown memory status: " + raw + " (expected active|resolved|deprecated|superseded)");
    }
}
