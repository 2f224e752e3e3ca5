package io.taskmesh.coordination;

import io.taskmesh.config.CoordinatorSettings;
import io.taskmesh.config.TaskMeshConfig;
import io.taskmesh.model.AgentRole;
import io.taskmesh.model.Complexity;
import io.taskmesh.model.NewTask;
import io.taskmesh.model.SkillLevel;
import io.taskmesh.model.TaskRecord;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.storage.Database;
import io.taskmesh.storage.StoreRetry;
import io.taskmesh.storage.TaskStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class LockManagerConcurrencyTest {

    @Test
    void exactlyOneOfManyConcurrentAgentsGetsTheLock() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-lock-race-");
        int agents = 8;
        ExecutorService pool = Executors.newFixedThreadPool(agents);
        try {
            TaskStore store = openStore(root);
            LockManager locks = new LockManager(store, new TaskStateMachine(TaskStatus.CREATED), Clock.systemUTC());
            StoreRetry retry = new StoreRetry(CoordinatorSettings.defaults());
            store.insertTask("tsk_race", newTask(), TaskStatus.CREATED, "pm-1", System.currentTimeMillis());

            CountDownLatch ready = new CountDownLatch(agents);
            CountDownLatch go = new CountDownLatch(1);
            List<Future<LockGrant>> results = new ArrayList<>();
            for (int i = 0; i < agents; i++) {
                String agentId = "agent-" + i;
                results.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    return retry.call("task.lock", () -> locks.acquire("tsk_race", agentId, null));
                }));
            }
            Assertions.assertTrue(ready.await(10, TimeUnit.SECONDS));
            go.countDown();

            List<LockGrant> grants = new ArrayList<>();
            for (Future<LockGrant> f : results) {
                grants.add(f.get(30, TimeUnit.SECONDS));
            }
            List<LockGrant> won = grants.stream().filter(LockGrant::granted).toList();
            Assertions.assertEquals(1, won.size());
            String winner = won.get(0).token().agentId();

            for (LockGrant g : grants) {
                if (!g.granted()) {
                    Assertions.assertEquals(winner, g.holder());
                    Assertions.assertEquals(TaskStatus.LOCKED, g.observedStatus());
                }
            }
            TaskRecord task = store.findTask("tsk_race").orElseThrow();
            Assertions.assertEquals(winner, task.lockedBy());
            Assertions.assertEquals(1L, task.lockEpoch());
            Assertions.assertEquals(agents - 1, store.lockConflictSummary(0L).total());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    @Test
    void relockByHolderIsIdempotentAndKeepsEpoch() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-relock-");
        try {
            TaskStore store = openStore(root);
            LockManager locks = new LockManager(store, new TaskStateMachine(TaskStatus.CREATED), Clock.systemUTC());
            store.insertTask("tsk_1", newTask(), TaskStatus.CREATED, "pm-1", System.currentTimeMillis());

            LockGrant first = locks.acquire("tsk_1", "agent-a", "/ctx");
            LockGrant again = locks.acquire("tsk_1", "agent-a", "/ctx");
            Assertions.assertTrue(first.granted());
            Assertions.assertTrue(again.granted());
            Assertions.assertEquals(first.token().lockEpoch(), again.token().lockEpoch());

            LockGrant other = locks.acquire("tsk_1", "agent-b", null);
            Assertions.assertFalse(other.granted());
            Assertions.assertEquals("agent-a", other.holder());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void lockingUnknownOrUnavailableTaskFails() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-lock-invalid-");
        try {
            TaskStore store = openStore(root);
            LockManager locks = new LockManager(store, new TaskStateMachine(TaskStatus.CREATED), Clock.systemUTC());
            store.insertTask("tsk_pending", newTask(), TaskStatus.PENDING, "dev-1", System.currentTimeMillis());

            Assertions.assertThrows(IllegalArgumentException.class, () -> locks.acquire("tsk_missing", "agent-a", null));
            Assertions.assertThrows(InvalidTransitionException.class, () -> locks.acquire("tsk_pending", "agent-a", null));
            Assertions.assertThrows(IllegalArgumentException.class, () -> locks.acquire("tsk_pending", " ", null));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseAfterForceReleaseIsRejected() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-release-");
        try {
            TaskStore store = openStore(root);
            LockManager locks = new LockManager(store, new TaskStateMachine(TaskStatus.CREATED), Clock.systemUTC());
            store.insertTask("tsk_1", newTask(), TaskStatus.CREATED, "pm-1", System.currentTimeMillis());
            Assertions.assertTrue(locks.acquire("tsk_1", "agent-a", null).granted());

            Assertions.assertTrue(locks.forceRelease("tsk_1").isPresent());
            Assertions.assertThrows(NotLockHolderException.class,
                    () -> locks.release("tsk_1", "agent-a", TaskStatus.DEV_DONE, null));

            LockGrant regrant = locks.acquire("tsk_1", "agent-b", null);
            Assertions.assertTrue(regrant.granted());
            Assertions.assertEquals(2L, regrant.token().lockEpoch());

            TaskRecord done = locks.release("tsk_1", "agent-b", TaskStatus.DEV_DONE, "done");
            Assertions.assertEquals(TaskStatus.DEV_DONE, done.status());
            Assertions.assertNull(done.lockedBy());
        } finally {
            deleteRecursively(root);
        }
    }

    static NewTask newTask() {
        return new NewTask("feat-1", "Race me", "", AgentRole.BACKEND_DEV, SkillLevel.JUNIOR, Complexity.MINOR, null, false);
    }

    private static TaskStore openStore(Path root) {
        Database db = new Database(TaskMeshConfig.fromRoot(root.toString()));
        db.init();
        return new TaskStore(db);
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
