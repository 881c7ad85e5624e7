package io.huddle.model;

import java.util.List;

public record SessionLogEntry(
        long id,
        String instanceId,
        String project,
        String action,
        String summary,
        List<String> filesModified,
        long createdAtMs
) {
}
