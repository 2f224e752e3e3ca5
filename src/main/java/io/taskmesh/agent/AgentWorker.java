package io.taskmesh.agent;

import io.taskmesh.coordination.InvalidTransitionException;
import io.taskmesh.coordination.LockGrant;
import io.taskmesh.coordination.NotLockHolderException;
import io.taskmesh.coordination.WaitCancellation;
import io.taskmesh.coordination.WaitOutcome;
import io.taskmesh.journal.JournalEntry;
import io.taskmesh.journal.JournalReconciler;
import io.taskmesh.logging.MdcContext;
import io.taskmesh.model.AgentRole;
import io.taskmesh.model.SkillLevel;
import io.taskmesh.model.TaskRecord;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.runtime.TaskMeshRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One agent's loop: recover first, then match, lock, journal, execute, report, clear.
 *
 * <p>The journal is written before the handler runs and cleared only after the task has left
 * the held state, so a crash at any point leaves either nothing to resume or an entry the
 * store can confirm. An execution timeout does not release the lock; the journal stays and
 * the next cycle resumes the task.
 */
public final class AgentWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentWorker.class);

    private final TaskMeshRuntime runtime;
    private final String agentId;
    private final AgentRole role;
    private final SkillLevel level;
    private final TaskHandler handler;
    private final String executionContext;
    private final long executionTimeoutMs;
    private final ExecutorService executor;
    private String resumedTaskId;
    private int consecutiveResumes;

    public AgentWorker(TaskMeshRuntime runtime,
                       String agentId,
                       AgentRole role,
                       SkillLevel level,
                       TaskHandler handler,
                       String executionContext) {
        this.runtime = runtime;
        this.agentId = agentId;
        this.role = role;
        this.level = level;
        this.handler = handler;
        this.executionContext = executionContext;
        this.executionTimeoutMs = runtime.settings().executionTimeoutMs();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "taskmesh-exec-" + agentId);
            t.setDaemon(true);
            return t;
        });
    }

    public void register() {
        runtime.register(agentId, role.wireName(), level.name());
    }

    /**
     * Runs cycles until {@code maxTasks} tasks have been finished (0 for unbounded) or the
     * wait is cancelled.
     */
    public int runLoop(int maxTasks, long waitMs, WaitCancellation cancellation) {
        int finished = 0;
        MdcContext.setAgent(agentId, role.wireName());
        try {
            while (!cancellation.isCancelled() && !Thread.currentThread().isInterrupted()) {
                CycleResult result = runOnce(waitMs, cancellation);
                if (result.outcome() == Outcome.CANCELLED) {
                    break;
                }
                if (result.outcome() == Outcome.IDLE) {
                    log.info("No eligible work for role={} level={}, waiting again", role.wireName(), level);
                }
                if (result.outcome() == Outcome.COMPLETED || result.outcome() == Outcome.FAILED) {
                    finished++;
                    if (maxTasks > 0 && finished >= maxTasks) {
                        break;
                    }
                }
            }
        } finally {
            MdcContext.clear();
        }
        return finished;
    }

    public CycleResult runOnce(long waitMs, WaitCancellation cancellation) {
        runtime.heartbeat(agentId);
        Optional<JournalReconciler.Resumable> resumable = runtime.reconciler().recover(agentId);
        if (resumable.isPresent()) {
            TaskRecord task = resumable.get().task();
            if (task.taskId().equals(resumedTaskId)) {
                consecutiveResumes++;
                log.warn("Resuming task={} from recovery journal again, resume count={}", task.taskId(), consecutiveResumes);
            } else {
                resumedTaskId = task.taskId();
                consecutiveResumes = 1;
                log.info("Resuming task={} from recovery journal", task.taskId());
            }
            return execute(task, true);
        }

        WaitOutcome outcome = runtime.nextTask(role, level, waitMs, cancellation);
        if (outcome.kind() == WaitOutcome.Kind.CANCELLED) {
            return CycleResult.of(Outcome.CANCELLED, null);
        }
        if (outcome.kind() == WaitOutcome.Kind.TIMEOUT) {
            return CycleResult.of(Outcome.IDLE, null);
        }
        TaskRecord candidate = outcome.task();
        LockGrant grant = runtime.lock(candidate.taskId(), agentId, executionContext);
        if (!grant.granted()) {
            log.info("Lost task={} to {}", candidate.taskId(), grant.holder());
            return CycleResult.of(Outcome.CONTENDED, candidate.taskId());
        }
        TaskRecord locked = runtime.getTask(candidate.taskId())
                .orElseThrow(() -> new IllegalStateException("Locked task vanished: " + candidate.taskId()));
        runtime.journal().record(JournalEntry.of(agentId, locked, runtime.clock().millis()));
        return execute(locked, false);
    }

    private CycleResult execute(TaskRecord task, boolean resumed) {
        String taskId = task.taskId();
        MdcContext.setTask(agentId, taskId);
        try {
            TaskContext context = new TaskContext(agentId, task,
                    task.executionContext() == null ? executionContext : task.executionContext(), resumed);
            TaskResult result;
            Future<TaskResult> future = executor.submit(() -> handler.execute(context));
            try {
                result = future.get(executionTimeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Task {} exceeded execution timeout of {} ms; lock kept for recovery", taskId, executionTimeoutMs);
                return CycleResult.of(Outcome.TIMED_OUT, taskId);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Handler {} failed on task {}", handler.id(), taskId, cause);
                result = TaskResult.fail(cause.getClass().getSimpleName() + ": " + cause.getMessage());
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return CycleResult.of(Outcome.CANCELLED, taskId);
            }
            return report(task, result);
        } finally {
            MdcContext.clearTask();
        }
    }

    private CycleResult report(TaskRecord task, TaskResult result) {
        String taskId = task.taskId();
        resumedTaskId = null;
        consecutiveResumes = 0;
        // Tasks reach the worker only through CREATED -> LOCKED.
        TaskStatus next = result.success() ? TaskStatus.DEV_DONE : TaskStatus.CREATED;
        String notes = result.success() ? result.output() : result.error();
        try {
            runtime.setStatus(taskId, agentId, next, notes);
        } catch (InvalidTransitionException | NotLockHolderException e) {
            // The store no longer agrees we hold the task, e.g. it was force-released.
            log.warn("Could not report task {}: {}", taskId, e.getMessage());
            runtime.journal().clear(agentId);
            return CycleResult.of(Outcome.LOST, taskId);
        }
        runtime.journal().clear(agentId);
        return CycleResult.of(result.success() ? Outcome.COMPLETED : Outcome.FAILED, taskId);
    }

    /**
     * Times the current journaled task has been resumed in a row without being reported.
     */
    int consecutiveResumes() {
        return consecutiveResumes;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    public enum Outcome {
        COMPLETED,
        FAILED,
        IDLE,
        CONTENDED,
        TIMED_OUT,
        LOST,
        CANCELLED
    }

    public record CycleResult(Outcome outcome, String taskId) {
        static CycleResult of(Outcome outcome, String taskId) {
            return new CycleResult(outcome, taskId);
        }
    }
}
