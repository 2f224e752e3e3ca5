package io.taskmesh.runtime;

import io.taskmesh.config.CoordinatorSettings;
import io.taskmesh.config.TaskMeshConfig;
import io.taskmesh.coordination.InvalidTransitionException;
import io.taskmesh.coordination.LockGrant;
import io.taskmesh.coordination.NotLockHolderException;
import io.taskmesh.coordination.TaskSignal;
import io.taskmesh.coordination.WaitOutcome;
import io.taskmesh.model.AgentRole;
import io.taskmesh.model.Complexity;
import io.taskmesh.model.NewTask;
import io.taskmesh.model.SkillLevel;
import io.taskmesh.model.TaskRecord;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.storage.TaskStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

final class TaskMeshRuntimeScenarioTest {

    @Test
    void taskFlowsFromCreationToCompletion() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-runtime-flow-");
        try {
            TaskMeshRuntime runtime = runtime(root);
            runtime.register("pm-1", "pm", "senior");
            runtime.register("dev-a", "backend_dev", "junior");
            runtime.register("dev-b", "backend_dev", "senior");
            runtime.register("qa-1", "qa", "junior");

            TaskRecord created = runtime.createTask(task(SkillLevel.JUNIOR, false), "pm-1");
            Assertions.assertEquals(TaskStatus.CREATED, created.status());
            Assertions.assertTrue(created.taskId().startsWith("tsk_"));

            WaitOutcome next = runtime.nextTask("backend_dev", "junior", 0L);
            Assertions.assertTrue(next.matched());
            Assertions.assertEquals(created.taskId(), next.task().taskId());

            LockGrant grant = runtime.lock(created.taskId(), "dev-a", "/repo/a");
            Assertions.assertTrue(grant.granted());
            Assertions.assertEquals("dev-a", grant.token().agentId());

            LockGrant refused = runtime.lock(created.taskId(), "dev-b", null);
            Assertions.assertFalse(refused.granted());
            Assertions.assertEquals("dev-a", refused.holder());
            Assertions.assertEquals(TaskStatus.LOCKED, refused.observedStatus());

            Assertions.assertThrows(NotLockHolderException.class,
                    () -> runtime.setStatus(created.taskId(), "dev-b", TaskStatus.DEV_DONE, null));

            TaskRecord devDone = runtime.setStatus(created.taskId(), "dev-a", TaskStatus.DEV_DONE, "implemented");
            Assertions.assertEquals(TaskStatus.DEV_DONE, devDone.status());
            Assertions.assertNull(devDone.lockedBy());

            Assertions.assertThrows(InvalidTransitionException.class,
                    () -> runtime.setStatus(created.taskId(), "dev-a", TaskStatus.TESTING, null));
            TaskRecord testing = runtime.setStatus(created.taskId(), "qa-1", TaskStatus.TESTING, null);
            Assertions.assertEquals("qa-1", testing.lockedBy());
            Assertions.assertEquals(2L, testing.lockEpoch());

            runtime.setStatus(created.taskId(), "qa-1", TaskStatus.QA_DONE, "passed");
            TaskRecord completed = runtime.setStatus(created.taskId(), "pm-1", TaskStatus.COMPLETED, null);
            Assertions.assertEquals(TaskStatus.COMPLETED, completed.status());
            Assertions.assertEquals("passed", completed.notes());

            Assertions.assertTrue(runtime.auditLogger().verify().valid());
            Assertions.assertTrue(runtime.lockConflictSummary(0L).total() >= 1);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void onlyRegisteredPrivilegedCreatorsPublishDirectly() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-runtime-create-");
        try {
            TaskMeshRuntime runtime = runtime(root);
            runtime.register("arch-1", "architect", "principal");
            runtime.register("dev-a", "frontend-dev", "senior");

            Assertions.assertEquals(TaskStatus.CREATED, runtime.createTask(task(SkillLevel.SENIOR, false), "arch-1").status());
            Assertions.assertEquals(TaskStatus.PENDING, runtime.createTask(task(SkillLevel.SENIOR, true), "arch-1").status());
            Assertions.assertEquals(TaskStatus.PENDING, runtime.createTask(task(SkillLevel.SENIOR, false), "dev-a").status());
            TaskRecord anonymous = runtime.createTask(task(SkillLevel.JUNIOR, false), "stranger");
            Assertions.assertEquals(TaskStatus.PENDING, anonymous.status());

            Assertions.assertThrows(InvalidTransitionException.class, () -> runtime.promote(anonymous.taskId(), "dev-a"));
            Assertions.assertThrows(InvalidTransitionException.class, () -> runtime.promote(anonymous.taskId(), "stranger"));
            Assertions.assertEquals(TaskStatus.CREATED, runtime.promote(anonymous.taskId(), "arch-1").status());

            Assertions.assertEquals(2, runtime.listTasks(TaskStatus.CREATED).size());
            Assertions.assertEquals(2, runtime.listTasks(TaskStatus.PENDING).size());
            Assertions.assertEquals(4, runtime.listTasks(null).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void promoteOnlyPublishesPendingTasks() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-runtime-promote-");
        try {
            TaskMeshRuntime runtime = runtime(root);
            runtime.register("pm-1", "pm", "senior");
            runtime.register("dev-a", "backend_dev", "junior");
            runtime.register("qa-1", "qa", "junior");

            TaskRecord created = runtime.createTask(task(SkillLevel.JUNIOR, false), "pm-1");
            Assertions.assertThrows(InvalidTransitionException.class, () -> runtime.promote(created.taskId(), "pm-1"));

            Assertions.assertTrue(runtime.lock(created.taskId(), "dev-a", null).granted());
            Assertions.assertThrows(InvalidTransitionException.class, () -> runtime.promote(created.taskId(), "dev-a"));
            Assertions.assertThrows(InvalidTransitionException.class, () -> runtime.promote(created.taskId(), "pm-1"));
            TaskRecord stillLocked = runtime.getTask(created.taskId()).orElseThrow();
            Assertions.assertEquals(TaskStatus.LOCKED, stillLocked.status());
            Assertions.assertEquals("dev-a", stillLocked.lockedBy());

            runtime.setStatus(created.taskId(), "dev-a", TaskStatus.DEV_DONE, null);
            runtime.setStatus(created.taskId(), "qa-1", TaskStatus.TESTING, null);
            Assertions.assertThrows(InvalidTransitionException.class, () -> runtime.promote(created.taskId(), "qa-1"));
            Assertions.assertEquals(TaskStatus.TESTING, runtime.getTask(created.taskId()).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedQaReturnsTaskForReworkUnderNewEpoch() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-runtime-rework-");
        try {
            TaskMeshRuntime runtime = runtime(root);
            runtime.register("pm-1", "pm", "senior");
            runtime.register("qa-1", "qa", "senior");
            String taskId = runtime.createTask(task(SkillLevel.JUNIOR, false), "pm-1").taskId();

            Assertions.assertEquals(1L, runtime.lock(taskId, "dev-a", null).token().lockEpoch());
            runtime.setStatus(taskId, "dev-a", TaskStatus.DEV_DONE, null);
            runtime.setStatus(taskId, "qa-1", TaskStatus.TESTING, null);
            TaskRecord rework = runtime.setStatus(taskId, "qa-1", TaskStatus.CREATED, "login button broken");
            Assertions.assertEquals(TaskStatus.CREATED, rework.status());
            Assertions.assertEquals("login button broken", rework.notes());

            LockGrant again = runtime.lock(taskId, "dev-c", null);
            Assertions.assertTrue(again.granted());
            Assertions.assertEquals(3L, again.token().lockEpoch());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleLocksCanBeForceReleased() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-runtime-stale-");
        try {
            TaskMeshRuntime runtime = runtime(root);
            runtime.register("pm-1", "pm", "senior");
            String taskId = runtime.createTask(task(SkillLevel.JUNIOR, false), "pm-1").taskId();
            runtime.lock(taskId, "dev-a", null);

            List<TaskRecord> stale = runtime.staleLocks(0L);
            Assertions.assertEquals(1, stale.size());
            Assertions.assertTrue(runtime.staleLocks().isEmpty());

            Optional<TaskStore.ForcedRelease> released = runtime.forceRelease(taskId, "pm-1");
            Assertions.assertTrue(released.isPresent());
            Assertions.assertEquals("dev-a", released.get().previousHolder());
            Assertions.assertTrue(runtime.forceRelease(taskId, "pm-1").isEmpty());
            Assertions.assertEquals(TaskStatus.CREATED, runtime.getTask(taskId).orElseThrow().status());

            Assertions.assertThrows(InvalidTransitionException.class,
                    () -> runtime.setStatus(taskId, "dev-a", TaskStatus.DEV_DONE, null));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.setStatus("tsk_missing", "dev-a", TaskStatus.DEV_DONE, null));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void registrationValidatesRoleAndLevel() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-runtime-register-");
        try {
            TaskMeshRuntime runtime = runtime(root);
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.register("x", "designer", "junior"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.register("x", "qa", "intern"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> runtime.register(" ", "qa", "junior"));
            Assertions.assertFalse(runtime.heartbeat("x"));

            runtime.register("x", "QA", "Junior");
            Assertions.assertTrue(runtime.heartbeat("x"));
            Assertions.assertEquals(AgentRole.QA, runtime.listAgents().get(0).role());
        } finally {
            deleteRecursively(root);
        }
    }

    static TaskMeshRuntime runtime(Path root) {
        CoordinatorSettings settings = CoordinatorSettings.defaults().withWaitPolling(20L, 100L);
        TaskMeshRuntime runtime = new TaskMeshRuntime(TaskMeshConfig.fromRoot(root.toString()), settings,
                Clock.systemUTC(), new TaskSignal());
        runtime.init();
        return runtime;
    }

    static NewTask task(SkillLevel level, boolean staged) {
        return new NewTask("feat-login", "Build login endpoint", "POST /login", AgentRole.BACKEND_DEV, level,
                Complexity.MAJOR, "feature/login", staged);
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
