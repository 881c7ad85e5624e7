package io.huddle.model;

public record InstanceView(
        String instanceId,
        String project,
        String workingDir,
        String model,
        String status,
        String currentTask,
        long startedAtMs,
        long lastHeartbeatMs,
        long secondsSinceHeartbeat
) {
}
