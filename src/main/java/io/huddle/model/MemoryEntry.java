package io.huddle.model;

import java.util.List;

/**
 * One memory row. {@code project}, {@code relatedFiles} and {@code status} are only populated
 * for {@link MemoryScope#PROJECT} entries.
 */
public record MemoryEntry(
        long id,
        MemoryScope scope,
        String project,
        String type,
        String title,
        String content,
        List<String> tags,
        List<String> relatedFiles,
        String status,
        String createdBy,
        long createdAtMs,
        long updatedAtMs
) {
}
