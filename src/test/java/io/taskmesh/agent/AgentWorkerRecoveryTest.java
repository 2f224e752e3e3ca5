package io.taskmesh.agent;

import io.taskmesh.config.CoordinatorSettings;
import io.taskmesh.config.TaskMeshConfig;
import io.taskmesh.coordination.LockGrant;
import io.taskmesh.coordination.TaskSignal;
import io.taskmesh.coordination.WaitCancellation;
import io.taskmesh.journal.JournalEntry;
import io.taskmesh.model.AgentRole;
import io.taskmesh.model.Complexity;
import io.taskmesh.model.NewTask;
import io.taskmesh.model.SkillLevel;
import io.taskmesh.model.TaskRecord;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.runtime.TaskMeshRuntime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

final class AgentWorkerRecoveryTest {

    @Test
    void cycleLocksJournalsExecutesAndReports() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-worker-cycle-");
        try {
            TaskMeshRuntime runtime = runtime(root, 10_000L);
            String taskId = publish(runtime);
            RecordingHandler handler = new RecordingHandler(runtime, "dev-a");

            try (AgentWorker worker = new AgentWorker(runtime, "dev-a", AgentRole.BACKEND_DEV, SkillLevel.JUNIOR, handler, "/repo")) {
                worker.register();
                AgentWorker.CycleResult result = worker.runOnce(0L, WaitCancellation.none());

                Assertions.assertEquals(AgentWorker.Outcome.COMPLETED, result.outcome());
                Assertions.assertEquals(taskId, result.taskId());
            }
            Assertions.assertEquals(List.of(taskId), handler.seenTasks);
            Assertions.assertTrue(handler.journaledDuringExecution.get());
            Assertions.assertFalse(handler.resumedFlags.get(0));
            TaskRecord after = runtime.getTask(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.DEV_DONE, after.status());
            Assertions.assertEquals("done", after.notes());
            Assertions.assertFalse(runtime.journal().exists("dev-a"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void journaledTaskIsResumedBeforeAnyNewWork() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-worker-resume-");
        try {
            TaskMeshRuntime runtime = runtime(root, 10_000L);
            String held = publish(runtime);
            LockGrant grant = runtime.lock(held, "dev-a", "/repo");
            runtime.journal().record(JournalEntry.of("dev-a", runtime.getTask(held).orElseThrow(), runtime.clock().millis()));
            String fresh = publish(runtime);
            RecordingHandler handler = new RecordingHandler(runtime, "dev-a");

            try (AgentWorker worker = new AgentWorker(runtime, "dev-a", AgentRole.BACKEND_DEV, SkillLevel.JUNIOR, handler, "/repo")) {
                AgentWorker.CycleResult result = worker.runOnce(0L, WaitCancellation.none());
                Assertions.assertEquals(AgentWorker.Outcome.COMPLETED, result.outcome());
                Assertions.assertEquals(held, result.taskId());
            }
            Assertions.assertEquals(List.of(held), handler.seenTasks);
            Assertions.assertTrue(handler.resumedFlags.get(0));
            Assertions.assertEquals(grant.token().lockEpoch(), handler.seenEpochs.get(0));
            Assertions.assertEquals(TaskStatus.CREATED, runtime.getTask(fresh).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void timedOutExecutionKeepsLockAndResumesNextCycle() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-worker-timeout-");
        try {
            TaskMeshRuntime runtime = runtime(root, 200L);
            String taskId = publish(runtime);
            RecordingHandler handler = new RecordingHandler(runtime, "dev-a");
            handler.blockNext.set(true);

            try (AgentWorker worker = new AgentWorker(runtime, "dev-a", AgentRole.BACKEND_DEV, SkillLevel.JUNIOR, handler, null)) {
                AgentWorker.CycleResult first = worker.runOnce(0L, WaitCancellation.none());
                Assertions.assertEquals(AgentWorker.Outcome.TIMED_OUT, first.outcome());
                TaskRecord stillHeld = runtime.getTask(taskId).orElseThrow();
                Assertions.assertEquals(TaskStatus.LOCKED, stillHeld.status());
                Assertions.assertEquals("dev-a", stillHeld.lockedBy());
                Assertions.assertTrue(runtime.journal().exists("dev-a"));

                AgentWorker.CycleResult second = worker.runOnce(0L, WaitCancellation.none());
                Assertions.assertEquals(AgentWorker.Outcome.COMPLETED, second.outcome());
                Assertions.assertEquals(taskId, second.taskId());
            }
            Assertions.assertEquals(List.of(taskId, taskId), handler.seenTasks);
            Assertions.assertEquals(List.of(false, true), handler.resumedFlags);
            Assertions.assertEquals(1L, runtime.getTask(taskId).orElseThrow().lockEpoch());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void repeatedTimeoutsCountResumesUntilReported() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-worker-resume-count-");
        try {
            TaskMeshRuntime runtime = runtime(root, 200L);
            String taskId = publish(runtime);
            RecordingHandler handler = new RecordingHandler(runtime, "dev-a");

            try (AgentWorker worker = new AgentWorker(runtime, "dev-a", AgentRole.BACKEND_DEV, SkillLevel.JUNIOR, handler, null)) {
                handler.blockNext.set(true);
                Assertions.assertEquals(AgentWorker.Outcome.TIMED_OUT, worker.runOnce(0L, WaitCancellation.none()).outcome());
                Assertions.assertEquals(0, worker.consecutiveResumes());

                handler.blockNext.set(true);
                Assertions.assertEquals(AgentWorker.Outcome.TIMED_OUT, worker.runOnce(0L, WaitCancellation.none()).outcome());
                Assertions.assertEquals(1, worker.consecutiveResumes());

                handler.blockNext.set(true);
                Assertions.assertEquals(AgentWorker.Outcome.TIMED_OUT, worker.runOnce(0L, WaitCancellation.none()).outcome());
                Assertions.assertEquals(2, worker.consecutiveResumes());

                Assertions.assertEquals(AgentWorker.Outcome.COMPLETED, worker.runOnce(0L, WaitCancellation.none()).outcome());
                Assertions.assertEquals(0, worker.consecutiveResumes());
            }
            Assertions.assertEquals(List.of(false, true, true, true), handler.resumedFlags);
            Assertions.assertEquals(TaskStatus.DEV_DONE, runtime.getTask(taskId).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedExecutionReturnsTaskToQueue() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-worker-fail-");
        try {
            TaskMeshRuntime runtime = runtime(root, 10_000L);
            String taskId = publish(runtime);
            RecordingHandler handler = new RecordingHandler(runtime, "dev-a");
            handler.failNext.set(true);

            try (AgentWorker worker = new AgentWorker(runtime, "dev-a", AgentRole.BACKEND_DEV, SkillLevel.JUNIOR, handler, null)) {
                Assertions.assertEquals(AgentWorker.Outcome.FAILED, worker.runOnce(0L, WaitCancellation.none()).outcome());
            }
            TaskRecord after = runtime.getTask(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.CREATED, after.status());
            Assertions.assertNull(after.lockedBy());
            Assertions.assertEquals("compile error", after.notes());
            Assertions.assertFalse(runtime.journal().exists("dev-a"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void forceReleaseDuringExecutionIsReportedAsLost() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-worker-lost-");
        try {
            TaskMeshRuntime runtime = runtime(root, 10_000L);
            String taskId = publish(runtime);
            RecordingHandler handler = new RecordingHandler(runtime, "dev-a");
            handler.forceReleaseNext.set(true);

            try (AgentWorker worker = new AgentWorker(runtime, "dev-a", AgentRole.BACKEND_DEV, SkillLevel.JUNIOR, handler, null)) {
                Assertions.assertEquals(AgentWorker.Outcome.LOST, worker.runOnce(0L, WaitCancellation.none()).outcome());
            }
            Assertions.assertEquals(TaskStatus.CREATED, runtime.getTask(taskId).orElseThrow().status());
            Assertions.assertFalse(runtime.journal().exists("dev-a"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void idleWhenNothingMatchesAndLoopStopsOnCancel() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-worker-idle-");
        try {
            TaskMeshRuntime runtime = runtime(root, 10_000L);
            publish(runtime);
            RecordingHandler handler = new RecordingHandler(runtime, "fe-1");
            WaitCancellation cancellation = new WaitCancellation();

            try (AgentWorker worker = new AgentWorker(runtime, "fe-1", AgentRole.FRONTEND_DEV, SkillLevel.PRINCIPAL, handler, null)) {
                Assertions.assertEquals(AgentWorker.Outcome.IDLE, worker.runOnce(0L, WaitCancellation.none()).outcome());
                cancellation.cancel();
                Assertions.assertEquals(0, worker.runLoop(0, 1_000L, cancellation));
            }
            Assertions.assertTrue(handler.seenTasks.isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void loopStopsAfterMaxTasks() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-worker-loop-");
        try {
            TaskMeshRuntime runtime = runtime(root, 10_000L);
            publish(runtime);
            publish(runtime);
            publish(runtime);
            RecordingHandler handler = new RecordingHandler(runtime, "dev-a");

            try (AgentWorker worker = new AgentWorker(runtime, "dev-a", AgentRole.BACKEND_DEV, SkillLevel.SENIOR, handler, null)) {
                Assertions.assertEquals(2, worker.runLoop(2, 0L, WaitCancellation.none()));
            }
            Assertions.assertEquals(2, handler.seenTasks.size());
            Assertions.assertEquals(1, runtime.listTasks(TaskStatus.CREATED).size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static final class RecordingHandler implements TaskHandler {
        private final TaskMeshRuntime runtime;
        private final String agentId;
        final List<String> seenTasks = new CopyOnWriteArrayList<>();
        final List<Boolean> resumedFlags = new CopyOnWriteArrayList<>();
        final List<Long> seenEpochs = new CopyOnWriteArrayList<>();
        final AtomicBoolean journaledDuringExecution = new AtomicBoolean();
        final AtomicBoolean blockNext = new AtomicBoolean();
        final AtomicBoolean failNext = new AtomicBoolean();
        final AtomicBoolean forceReleaseNext = new AtomicBoolean();

        RecordingHandler(TaskMeshRuntime runtime, String agentId) {
            this.runtime = runtime;
            this.agentId = agentId;
        }

        @Override
        public String id() {
            return "recording";
        }

        @Override
        public TaskResult execute(TaskContext context) throws Exception {
            seenTasks.add(context.task().taskId());
            resumedFlags.add(context.resumed());
            seenEpochs.add(context.task().lockEpoch());
            journaledDuringExecution.set(runtime.journal().exists(agentId));
            if (blockNext.getAndSet(false)) {
                Thread.sleep(30_000L);
            }
            if (forceReleaseNext.getAndSet(false)) {
                runtime.forceRelease(context.task().taskId(), "admin");
            }
            if (failNext.getAndSet(false)) {
                return TaskResult.fail("compile error");
            }
            return TaskResult.ok("done");
        }
    }

    private static TaskMeshRuntime runtime(Path root, long executionTimeoutMs) {
        CoordinatorSettings d = CoordinatorSettings.defaults();
        CoordinatorSettings settings = new CoordinatorSettings(
                20L, 100L, d.defaultWaitMs(), d.staleLockThresholdMs(), executionTimeoutMs, TaskStatus.CREATED,
                d.storeRetryAttempts(), d.storeRetryBaseMs(), d.storeRetryMaxMs(), d.brokerLivenessTimeoutMs(),
                d.brokerReapIntervalMs(), d.brokerMaxStartsPerWindow(), d.brokerStartWindowMs()
        );
        TaskMeshRuntime runtime = new TaskMeshRuntime(TaskMeshConfig.fromRoot(root.toString()), settings,
                Clock.systemUTC(), new TaskSignal());
        runtime.init();
        runtime.register("pm-1", "pm", "principal");
        return runtime;
    }

    private static String publish(TaskMeshRuntime runtime) {
        return runtime.createTask(new NewTask("feat-1", "Wire the API", "", AgentRole.BACKEND_DEV, SkillLevel.JUNIOR,
                Complexity.MINOR, null, false), "pm-1").taskId();
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
