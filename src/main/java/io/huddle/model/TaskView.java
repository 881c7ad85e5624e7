package io.huddle.model;

import java.util.List;

public record TaskView(
        long id,
        String title,
        String description,
        String project,
        int priority,
        String assignedRole,
        List<String> fileScope,
        List<String> dependsOn,
        String assignedInstance,
        String status,
        String result,
        String createdBy,
        long createdAtMs,
        Long claimedAtMs,
        Long completedAtMs
) {
}
