package io.taskmesh.coordination;

import io.taskmesh.model.LockToken;
import io.taskmesh.model.TaskRecord;
import io.taskmesh.model.TaskStatus;
import io.taskmesh.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Test-and-set ownership of tasks on top of {@link TaskStore}.
 *
 * <p>Nothing here caches ownership. Every decision is the row count of one conditional
 * update; the follow-up read only classifies a lost race.
 */
public final class LockManager {
    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final TaskStore store;
    private final TaskStateMachine stateMachine;
    private final Clock clock;

    public LockManager(TaskStore store, TaskStateMachine stateMachine, Clock clock) {
        this.store = store;
        this.stateMachine = stateMachine;
        this.clock = clock;
    }

    public LockGrant acquire(String taskId, String agentId, String executionContext) {
        requireId(taskId, "taskId");
        requireId(agentId, "agentId");
        long now = clock.millis();
        TaskStore.ClaimResult result = store.tryClaim(taskId, agentId, TaskStatus.CREATED, TaskStatus.LOCKED,
                executionContext, now);
        TaskRecord actual = result.actual();
        if (result.won()) {
            log.info("Lock granted task={} agent={} epoch={}", taskId, agentId, actual.lockEpoch());
            return LockGrant.granted(toToken(actual));
        }
        if (actual == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        if (actual.status() == TaskStatus.LOCKED && agentId.equals(actual.lockedBy())) {
            // Re-lock by the holder, e.g. a retried call whose first attempt committed.
            log.info("Lock already held by caller task={} agent={} epoch={}", taskId, agentId, actual.lockEpoch());
            return LockGrant.granted(toToken(actual));
        }
        if (actual.status().held()) {
            log.info("Lock refused task={} agent={} holder={} status={}", taskId, agentId, actual.lockedBy(), actual.status());
            return LockGrant.alreadyLocked(actual.lockedBy(), actual.status());
        }
        throw new InvalidTransitionException(taskId, agentId, actual.status(), TaskStatus.LOCKED,
                "only created tasks can be locked");
    }

    /**
     * Applies a transition already permitted by {@link TaskStateMachine}.
     */
    public TaskRecord apply(TaskRecord current, TaskStateMachine.Transition transition, String agentId, String notes) {
        String taskId = current.taskId();
        long now = clock.millis();
        if (transition.mode() == TaskStateMachine.Mode.CLAIM) {
            TaskStore.ClaimResult result = store.tryClaim(taskId, agentId, transition.from(), transition.to(), null, now);
            if (result.won()) {
                log.info("Task {} claimed {} -> {} by {}", taskId, transition.from(), transition.to(), agentId);
                return result.actual();
            }
            throw lostRace(taskId, agentId, transition, result.actual());
        }
        boolean requireHolder = transition.mode() == TaskStateMachine.Mode.HOLDER;
        TaskStore.TransitionResult result = store.tryTransition(taskId, agentId, transition.from(), transition.to(),
                requireHolder, notes, now);
        if (result.applied()) {
            log.info("Task {} moved {} -> {} by {}", taskId, transition.from(), transition.to(), agentId);
            return result.actual();
        }
        throw lostRace(taskId, agentId, transition, result.actual());
    }

    /**
     * Holder-only exit from a held state into {@code nextStatus}.
     */
    public TaskRecord release(String taskId, String agentId, TaskStatus nextStatus, String notes) {
        TaskRecord current = store.findTask(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        if (!current.heldBy(agentId)) {
            throw new NotLockHolderException(taskId, agentId, current.lockedBy());
        }
        TaskStateMachine.Transition transition = stateMachine.resolve(current, agentId, null, nextStatus);
        if (transition.mode() != TaskStateMachine.Mode.HOLDER) {
            throw new InvalidTransitionException(taskId, agentId, current.status(), nextStatus,
                    "release must leave a held state");
        }
        return apply(current, transition, agentId, notes);
    }

    public Optional<TaskStore.ForcedRelease> forceRelease(String taskId) {
        Optional<TaskStore.ForcedRelease> released = store.forceRelease(taskId, clock.millis());
        released.ifPresentOrElse(
                r -> log.warn("Force-released task={} previousHolder={} {} -> {}",
                        taskId, r.previousHolder(), r.fromStatus(), r.toStatus()),
                () -> log.info("Force-release skipped, task={} is not held", taskId));
        return released;
    }

    public List<TaskRecord> staleLocks(long thresholdMs) {
        return store.staleLocks(thresholdMs, clock.millis());
    }

    public static LockToken toToken(TaskRecord task) {
        return new LockToken(
                task.taskId(),
                task.lockedBy(),
                task.lockedAtMs() == null ? 0L : task.lockedAtMs(),
                task.lockEpoch(),
                task.executionContext()
        );
    }

    private static RuntimeException lostRace(String taskId, String agentId,
                                             TaskStateMachine.Transition transition, TaskRecord actual) {
        if (actual == null) {
            return new IllegalArgumentException("Unknown task: " + taskId);
        }
        if (actual.status() == transition.from() && transition.mode() == TaskStateMachine.Mode.HOLDER) {
            return new NotLockHolderException(taskId, agentId, actual.lockedBy());
        }
        return new InvalidTransitionException(taskId, agentId, actual.status(), transition.to(),
                "task moved to " + actual.status() + " concurrently");
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
