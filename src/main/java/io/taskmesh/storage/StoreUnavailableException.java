package io.taskmesh.storage;

import io.taskmesh.coordination.CoordinationException;

/**
 * The entity store could not be reached or refused the statement (busy, locked, I/O).
 * Callers retry with backoff; see {@link StoreRetry}.
 */
public final class StoreUnavailableException extends CoordinationException {
    private final String operation;

    public StoreUnavailableException(String operation, String taskId, String agentId, Throwable cause) {
        super("Store unavailable during " + operation
                + (taskId == null ? "" : " task=" + taskId)
                + (agentId == null ? "" : " agent=" + agentId), taskId, agentId, cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
