package io.huddle.model;

import java.util.Locale;

public enum SessionAction {
    STARTED,
    TASK_STARTED,
    TASK_COMPLETED,
    ISSUE_FOUND,
    ISSUE_RESOLVED,
    DOCKER_OPERATION,
    FILE_MODIFIED,
    SHUTDOWN;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SessionAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Session action must not be blank");
        }
        for (SessionAction value : values()) {
            if (value.wireValue().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown session action: " + raw);
    }
}
