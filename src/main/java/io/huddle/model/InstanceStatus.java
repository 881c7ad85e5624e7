package io.huddle.model;

import java.util.Locale;

public enum InstanceStatus {
    ACTIVE,
    IDLE,
    BUSY,
    SHUTTING_DOWN;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static InstanceStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Instance status must not be blank");
        }
        String v = raw.trim();
        for (InstanceStatus value : values()) {
            if (value.name().equalsIgnoreCase(v) || value.wireValue().equalsIgnoreCase(v)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown instance status: " + raw + " (expected active|idle|busy|shutting_down)");
    }
}
