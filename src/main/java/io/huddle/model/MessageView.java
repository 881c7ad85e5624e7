package io.huddle.model;

public record MessageView(
        long id,
        String fromInstance,
        String fromProject,
        String toTarget,
        String type,
        String subject,
        String body,
        boolean read,
        long createdAtMs,
        Long expiresAtMs
) {
}
