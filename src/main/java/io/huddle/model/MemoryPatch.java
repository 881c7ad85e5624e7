package io.huddle.model;

/**
 * Partial update of a memory entry. Null fields are left untouched.
 */
public record MemoryPatch(String title, String content, MemoryStatus status) {
}
