package io.huddle.storage;

import io.huddle.config.HuddleConfig;
import io.huddle.model.TaskStatus;
import io.huddle.model.TaskView;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class TaskStoreClaimTest {
    private static final long NOW = 1_750_000_000_000L;

    @Test
    void concurrentClaimsHaveExactlyOneWinner() throws Exception {
        Path root = Files.createTempDirectory("huddle-test-claim-race-");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            TaskStore store = newStore(root);
            long taskId = store.create(task("race", "p", 0, NOW));

            CountDownLatch start = new CountDownLatch(1);
            List<Future<Optional<TaskView>>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                String instanceId = "inst-" + i;
                Callable<Optional<TaskView>> claimer = () -> {
                    start.await(2, TimeUnit.SECONDS);
                    return store.claim(taskId, instanceId, NOW + 1L);
                };
                futures.add(pool.submit(claimer));
            }
            start.countDown();

            List<TaskView> winners = new ArrayList<>();
            for (Future<Optional<TaskView>> f : futures) {
                f.get(15, TimeUnit.SECONDS).ifPresent(winners::add);
            }
            Assertions.assertEquals(1, winners.size(), "exactly one concurrent claim may succeed");

            TaskView stored = store.find(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.CLAIMED.wireValue(), stored.status());
            Assertions.assertEquals(winners.get(0).assignedInstance(), stored.assignedInstance());
            Assertions.assertEquals(NOW + 1L, stored.claimedAtMs());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void claimedTaskCannotBeClaimedAgain() throws Exception {
        Path root = Files.createTempDirectory("huddle-test-no-reclaim-");
        try {
            TaskStore store = newStore(root);
            long taskId = store.create(task("once", "p", 0, NOW));

            Assertions.assertTrue(store.claim(taskId, "a", NOW + 1L).isPresent());
            Assertions.assertTrue(store.claim(taskId, "b", NOW + 2L).isEmpty());
            Assertions.assertTrue(store.claim(taskId, "a", NOW + 3L).isEmpty());
            Assertions.assertTrue(store.claim(9_999L, "a", NOW + 4L).isEmpty());

            TaskView stored = store.find(taskId).orElseThrow();
            Assertions.assertEquals("a", stored.assignedInstance());
            Assertions.assertEquals(NOW + 1L, stored.claimedAtMs());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void terminalTasksAreNeverChanged() throws Exception {
        Path root = Files.createTempDirectory("huddle-test-terminal-");
        try {
            TaskStore store = newStore(root);
            long doneId = store.create(task("done", "p", 0, NOW));
            long failedId = store.create(task("failed", "p", 0, NOW));
            store.claim(doneId, "a", NOW + 1L);
            store.claim(failedId, "a", NOW + 1L);

            Assertions.assertTrue(store.complete(doneId, "a", "shipped", NOW + 2L).isPresent());
            Assertions.assertTrue(store.fail(failedId, "broken", NOW + 2L));

            Assertions.assertTrue(store.complete(doneId, "a", "again", NOW + 3L).isEmpty());
            Assertions.assertFalse(store.fail(doneId, "late", NOW + 3L));
            Assertions.assertTrue(store.complete(failedId, null, "revive", NOW + 3L).isEmpty());
            Assertions.assertFalse(store.fail(failedId, "twice", NOW + 3L));
            Assertions.assertTrue(store.claim(doneId, "b", NOW + 3L).isEmpty());

            TaskView done = store.find(doneId).orElseThrow();
            Assertions.assertEquals("done", done.status());
            Assertions.assertEquals("shipped", done.result());
            Assertions.assertEquals(NOW + 2L, done.completedAtMs());

            TaskView failed = store.find(failedId).orElseThrow();
            Assertions.assertEquals("failed", failed.status());
            Assertions.assertEquals("broken", failed.result());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void completionFallsBackToAdministrativeOverride() throws Exception {
        Path root = Files.createTempDirectory("huddle-test-done-fallback-");
        try {
            TaskStore store = newStore(root);
            long claimedByA = store.create(task("claimed by a", "p", 0, NOW));
            long ownTask = store.create(task("own", "p", 0, NOW));
            long pending = store.create(task("never claimed", "p", 0, NOW));
            store.claim(claimedByA, "a", NOW + 1L);
            store.claim(ownTask, "b", NOW + 1L);

            TaskStore.Completion own = store.complete(ownTask, "b", "mine", NOW + 2L).orElseThrow();
            Assertions.assertFalse(own.administrativeOverride());
            Assertions.assertEquals("done", own.task().status());

            TaskStore.Completion override = store.complete(claimedByA, "b", "by b", NOW + 2L).orElseThrow();
            Assertions.assertTrue(override.administrativeOverride());
            Assertions.assertEquals("done", override.task().status());
            Assertions.assertEquals("a", override.task().assignedInstance(), "override keeps the original claimant");

            TaskStore.Completion anonymous = store.complete(pending, null, null, NOW + 2L).orElseThrow();
            Assertions.assertTrue(anonymous.administrativeOverride());
            Assertions.assertNull(anonymous.task().assignedInstance());

            Assertions.assertTrue(store.complete(12_345L, "b", null, NOW + 3L).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void listOrdersByPriorityThenCreation() throws Exception {
        Path root = Files.createTempDirectory("huddle-test-task-order-");
        try {
            TaskStore store = newStore(root);
            long low = store.create(task("low", "p", 0, NOW));
            long highLater = store.create(task("high later", "p", 5, NOW + 10L));
            long highEarlier = store.create(task("high earlier", "p", 5, NOW + 5L));
            long highSameTime = store.create(task("high same time", "p", 5, NOW + 5L));
            long otherProject = store.create(task("other", "q", 9, NOW));

            List<Long> ids = store.list(new TaskStore.TaskQuery("p", null, null, false)).stream()
                    .map(TaskView::id)
                    .toList();
            Assertions.assertEquals(List.of(highEarlier, highSameTime, highLater, low), ids);

            List<Long> all = store.list(new TaskStore.TaskQuery(null, null, null, false)).stream()
                    .map(TaskView::id)
                    .toList();
            Assertions.assertEquals(otherProject, all.get(0));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void availableOnlyIgnoresStatusFilterAndRespectsRole() throws Exception {
        Path root = Files.createTempDirectory("huddle-test-task-available-");
        try {
            TaskStore store = newStore(root);
            long coderPending = store.create(new TaskStore.NewTask("c1", null, "p", 0, "coder",
                    List.of("src/A.java"), List.of(), "human", NOW));
            long qaPending = store.create(new TaskStore.NewTask("q1", null, "p", 0, "qa",
                    List.of(), List.of(), "human", NOW));
            long coderClaimed = store.create(new TaskStore.NewTask("c2", null, "p", 0, "coder",
                    List.of(), List.of(String.valueOf(coderPending)), "human", NOW));
            store.claim(coderClaimed, "x", NOW + 1L);

            List<TaskView> available = store.list(new TaskStore.TaskQuery("p", TaskStatus.CLAIMED, "coder", true));
            Assertions.assertEquals(1, available.size());
            Assertions.assertEquals(coderPending, available.get(0).id());
            Assertions.assertEquals(List.of("src/A.java"), available.get(0).fileScope());

            List<TaskView> claimed = store.list(new TaskStore.TaskQuery("p", TaskStatus.CLAIMED, null, false));
            Assertions.assertEquals(1, claimed.size());
            Assertions.assertEquals(coderClaimed, claimed.get(0).id());
            Assertions.assertEquals(List.of(String.valueOf(coderPending)), claimed.get(0).dependsOn());

            List<TaskView> qa = store.list(TaskStore.TaskQuery.available(null, "qa"));
            Assertions.assertEquals(List.of(qaPending), qa.stream().map(TaskView::id).toList());
        } finally {
            deleteRecursively(root);
        }
    }

    private static TaskStore newStore(Path root) {
        Database db = new Database(HuddleConfig.fromRoot(root.toString()));
        db.init();
        return new TaskStore(db);
    }

    private static TaskStore.NewTask task(String title, String project, int priority, long createdAtMs) {
        return new TaskStore.NewTask(title, null, project, priority, null, List.of(), List.of(), "human", createdAtMs);
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
