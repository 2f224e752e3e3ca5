package io.taskmesh.coordination;

import io.taskmesh.model.LockToken;
import io.taskmesh.model.TaskStatus;

/**
 * Result of a lock acquisition. Losing a race is an expected outcome, not an error: callers
 * go back to matching rather than retrying the same lock.
 */
public record LockGrant(boolean granted, LockToken token, String holder, TaskStatus observedStatus) {
    public static LockGrant granted(LockToken token) {
        return new LockGrant(true, token, token.agentId(), TaskStatus.LOCKED);
    }

    public static LockGrant alreadyLocked(String holder, TaskStatus observedStatus) {
        return new LockGrant(false, null, holder, observedStatus);
    }
}
