package io.huddle.model;

import java.util.Locale;
import java.util.Set;

/**
 * Project-scoped and global memory share a shape but accept different entry types.
 */
public enum MemoryScope {
    PROJECT("project_memory", Set.of(
            "architecture", "feature", "issue", "fix", "decision", "pattern", "gotcha", "update")),
    GLOBAL("global_memory", Set.of(
            "infrastructure", "convention", "tool", "preference", "credential", "lesson"));

    private final String table;
    private final Set<String> types;

    MemoryScope(String table, Set<String> types) {
        this.table = table;
        this.types = types;
    }

    public String table() {
        return table;
    }

    public String requireType(String raw) {
        String v = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (!types.contains(v)) {
            throw new IllegalArgumentException(
                    "Unknown " + name().toLowerCase(Locale.ROOT) + " memory type: " + raw + " (expected one of " + types.stream().sorted().toList() + ")");
        }
        return v;
    }
}
