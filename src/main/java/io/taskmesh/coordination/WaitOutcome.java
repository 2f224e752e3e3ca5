package io.taskmesh.coordination;

import io.taskmesh.model.TaskRecord;

/**
 * Result of a long-poll. A timeout is an ordinary outcome: the caller loops or gives up.
 */
public record WaitOutcome(Kind kind, TaskRecord task, long waitedMs, int polls) {
    public enum Kind {
        MATCHED,
        TIMEOUT,
        CANCELLED
    }

    public static WaitOutcome matched(TaskRecord task, long waitedMs, int polls) {
        return new WaitOutcome(Kind.MATCHED, task, waitedMs, polls);
    }

    public static WaitOutcome timeout(long waitedMs, int polls) {
        return new WaitOutcome(Kind.TIMEOUT, null, waitedMs, polls);
    }

    public static WaitOutcome cancelled(long waitedMs, int polls) {
        return new WaitOutcome(Kind.CANCELLED, null, waitedMs, polls);
    }

    public boolean matched() {
        return kind == Kind.MATCHED;
    }
}
