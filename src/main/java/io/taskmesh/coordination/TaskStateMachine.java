package io.taskmesh.coordination;

import io.taskmesh.model.AgentRole;
import io.taskmesh.model.TaskRecord;
import io.taskmesh.model.TaskStatus;

/**
 * Transition rules for the task lifecycle
 * {@code PENDING -> CREATED -> LOCKED -> DEV_DONE -> TESTING -> QA_DONE -> COMPLETED}.
 *
 * <p>{@link #resolve} is a total function of (current state, actor, requested state). It
 * either names how the transition must be applied against the store or throws. The store's
 * conditional update still decides the outcome; this check only rejects requests that can
 * never succeed.
 */
public final class TaskStateMachine {
    private final TaskStatus reworkTarget;

    public TaskStateMachine(TaskStatus reworkTarget) {
        if (reworkTarget != TaskStatus.CREATED && reworkTarget != TaskStatus.PENDING) {
            throw new IllegalArgumentException("reworkTarget must be CREATED or PENDING: " + reworkTarget);
        }
        this.reworkTarget = reworkTarget;
    }

    public TaskStatus reworkTarget() {
        return reworkTarget;
    }

    public Transition resolve(TaskRecord task, String agentId, AgentRole actorRole, TaskStatus requested) {
        TaskStatus current = task.status();
        String taskId = task.taskId();
        if (requested == null) {
            throw new IllegalArgumentException("requested status must not be null");
        }
        switch (current) {
            case PENDING -> {
                if (requested == TaskStatus.CREATED) {
                    requirePrivileged(task, agentId, actorRole, requested);
                    return new Transition(current, requested, Mode.OPEN);
                }
            }
            case CREATED -> {
                if (requested == TaskStatus.LOCKED) {
                    throw new InvalidTransitionException(taskId, agentId, current, requested,
                            "locks are only granted by lock acquisition");
                }
            }
            case LOCKED -> {
                if (requested == TaskStatus.DEV_DONE || requested == TaskStatus.CREATED) {
                    requireHolder(task, agentId);
                    return new Transition(current, requested, Mode.HOLDER);
                }
            }
            case DEV_DONE -> {
                if (requested == TaskStatus.TESTING) {
                    if (actorRole != AgentRole.QA) {
                        throw new InvalidTransitionException(taskId, agentId, current, requested,
                                "only a qa agent may start testing");
                    }
                    return new Transition(current, requested, Mode.CLAIM);
                }
            }
            case TESTING -> {
                if (requested == TaskStatus.QA_DONE || requested == reworkTarget) {
                    requireHolder(task, agentId);
                    return new Transition(current, requested, Mode.HOLDER);
                }
            }
            case QA_DONE -> {
                if (requested == TaskStatus.COMPLETED) {
                    if (actorRole != AgentRole.QA && (actorRole == null || !actorRole.privileged())) {
                        throw new InvalidTransitionException(taskId, agentId, current, requested,
                                "only qa or a privileged role may complete a task");
                    }
                    return new Transition(current, requested, Mode.OPEN);
                }
            }
            case COMPLETED -> {
                // terminal
            }
        }
        throw new InvalidTransitionException(taskId, agentId, current, requested, null);
    }

    private static void requirePrivileged(TaskRecord task, String agentId, AgentRole actorRole, TaskStatus requested) {
        if (actorRole == null || !actorRole.privileged()) {
            throw new InvalidTransitionException(task.taskId(), agentId, task.status(), requested,
                    "requires a privileged role");
        }
    }

    private static void requireHolder(TaskRecord task, String agentId) {
        if (!task.heldBy(agentId)) {
            throw new NotLockHolderException(task.taskId(), agentId, task.lockedBy());
        }
    }

    /**
     * How a permitted transition is applied.
     */
    public enum Mode {
        /** Unheld task moves into a held state; the actor becomes the holder. */
        CLAIM,
        /** Held task leaves the held state; only the current holder may do this. */
        HOLDER,
        /** Unheld task moves between unheld states. */
        OPEN
    }

    public record Transition(TaskStatus from, TaskStatus to, Mode mode) {
    }
}
