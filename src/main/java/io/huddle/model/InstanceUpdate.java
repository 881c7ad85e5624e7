package io.huddle.model;

/**
 * Heartbeat payload. The heartbeat timestamp always moves; {@code currentTask} and {@code status}
 * change only when non-null.
 */
public record InstanceUpdate(String currentTask, InstanceStatus status) {
    public static InstanceUpdate heartbeatOnly() {
        return new InstanceUpdate(null, null);
    }
}
