package io.huddle.model;

import java.util.Locale;

public enum MessageType {
    INFO,
    WARNING,
    BLOCKER,
    REQUEST,
    DONE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        for (MessageType value : values()) {
            if (value.wireValue().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + raw + " (expected info|warning|blocker|request|done)");
    }
}
