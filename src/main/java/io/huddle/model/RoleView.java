package io.huddle.model;

import java.util.List;

public record RoleView(
        String name,
        String description,
        String systemPrompt,
        List<String> capabilities,
        long updatedAtMs
) {
}
