package io.huddle.storage;

import io.huddle.config.HuddleConfig;
import io.huddle.model.MemoryEntry;
import io.huddle.model.MemoryPatch;
import io.huddle.model.MemoryScope;
import io.huddle.model.MemoryStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class MemoryStoreTest {
    private static final long NOW = 1_750_000_000_000L;

    @Test
    void recallFiltersByTypeSearchAndStatus() throws Exception {
        Path root = Files.createTempDirectory("huddle-test-recall-");
        try {
            MemoryStore store = newStore(root);
            long gotcha = store.insert(project("gotcha", "WAL needs shared memory", "Use a local disk", NOW));
            long fix = store.insert(project("fix", "Retry on BUSY", "Set busy_timeout on every connection", NOW + 1L));
            long resolved = store.insert(project("issue", "Flaky claim test", "wal busy", NOW + 2L));
            store.insert(new MemoryStore.NewMemory(MemoryScope.PROJECT, "other", "fix", "WAL elsewhere", "x",
                    List.of(), List.of(), "human", NOW));
            Assertions.assertTrue(store.update(MemoryScope.PROJECT, resolved,
                    new MemoryPatch(null, null, MemoryStatus.RESOLVED), NOW + 3L));

            List<Long> all = ids(store.recall(new MemoryStore.RecallQuery(MemoryScope.PROJECT, "alpha", null, null, 20)));
            Assertions.assertEquals(List.of(fix, gotcha), all);

            List<Long> wal = ids(store.recall(new MemoryStore.RecallQuery(MemoryScope.PROJECT, "alpha", null, "wal", 20)));
            Assertions.assertEquals(List.of(gotcha), wal);

            List<Long> busy = ids(store.recall(new MemoryStore.RecallQuery(MemoryScope.PROJECT, "alpha", "fix", "BUSY", 20)));
            Assertions.assertEquals(List.of(fix), busy);

            List<Long> limited = ids(store.recall(new MemoryStore.RecallQuery(MemoryScope.PROJECT, "alpha", null, null, 1)));
            Assertions.assertEquals(List.of(fix), limited);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void searchTreatsLikeWildcardsLiterally() throws Exception {
        Path root = Files.createTempDirectory("huddle-test-recall-escape-");
        try {
            MemoryStore store = newStore(root);
            long percent = store.insert(project("pattern", "100% coverage", "target", NOW));
            store.insert(project("pattern", "1000 coverage", "target", NOW));
            long underscore = store.insert(project("pattern", "snake_case names", "target", NOW));
            store.insert(project("pattern", "snakeXcase names", "target", NOW));

            Assertions.assertEquals(List.of(percent),
                    ids(store.recall(new MemoryStore.RecallQuery(MemoryScope.PROJECT, "alpha", null, "0%", 20))));
            Assertions.assertEquals(List.of(underscore),
                    ids(store.recall(new MemoryStore.RecallQuery(MemoryScope.PROJECT, "alpha", null, "e_c", 20))));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void updateWritesOnlySuppliedFields() throws Exception {
        Path root = Files.createTempDirectory("huddle-test-memory-update-");
        try {
            MemoryStore store = newStore(root);
            long id = store.insert(project("decision", "Use SQLite", "single file database", NOW));

            Assertions.assertTrue(store.update(MemoryScope.PROJECT, id, new MemoryPatch(null, "WAL mode, busy timeout", null), NOW + 5L));
            MemoryEntry entry = store.find(MemoryScope.PROJECT, id).orElseThrow();
            Assertions.assertEquals("Use SQLite", entry.title());
            Assertions.assertEquals("WAL mode, busy timeout", entry.content());
            Assertions.assertEquals("active", entry.status());
            Assertions.assertEquals(NOW, entry.createdAtMs());
            Assertions.assertEquals(NOW + 5L, entry.updatedAtMs());

            Assertions.assertTrue(store.update(MemoryScope.PROJECT, id, new MemoryPatch(null, null, null), NOW + 6L));
            Assertions.assertEquals(NOW + 6L, store.find(MemoryScope.PROJECT, id).orElseThrow().updatedAtMs());

            Assertions.assertFalse(store.update(MemoryScope.PROJECT, id + 50L, new MemoryPatch("x", null, null), NOW + 7L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void globalScopeHasNoStatus() throws Exception {
        Path root = Files.createTempDirectory("huddle-test-memory-global-");
        try {
            MemoryStore store = newStore(root);
            long id = store.insert(new MemoryStore.NewMemory(MemoryScope.GLOBAL, null, "convention", "Tabs",
                    "Four spaces, never tabs", List.of("style"), List.of(), "human", NOW));

            MemoryEntry entry = store.find(MemoryScope.GLOBAL, id).orElseThrow();
            Assertions.assertNull(entry.project());
            Assertions.assertNull(entry.status());
            Assertions.assertEquals(List.of("style"), entry.tags());

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> store.update(MemoryScope.GLOBAL, id, new MemoryPatch(null, null, MemoryStatus.RESOLVED), NOW + 1L));
            Assertions.assertEquals(1, store.recall(new MemoryStore.RecallQuery(MemoryScope.GLOBAL, null, "convention", "tab", 20)).size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static List<Long> ids(List<MemoryEntry> entries) {
        return entries.stream().map(MemoryEntry::id).toList();
    }

    private static MemoryStore.NewMemory project(String type, String title, String content, long nowMs) {
        return new MemoryStore.NewMemory(MemoryScope.PROJECT, "alpha", type, title, content,
                List.of(), List.of("src/Db.java"), "human", nowMs);
    }

    private static MemoryStore newStore(Path root) {
        Database db = new Database(HuddleConfig.fromRoot(root.toString()));
        db.init();
        return new MemoryStore(db);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
