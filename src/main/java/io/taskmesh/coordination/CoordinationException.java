package io.taskmesh.coordination;

/**
 * Root of the failures the coordination core surfaces to callers.
 *
 * <p>Contention outcomes ({@code AlreadyLocked}) and wait timeouts are not failures and
 * travel as values ({@link LockGrant}, {@link WaitOutcome}) instead.
 */
public class CoordinationException extends RuntimeException {
    private final String taskId;
    private final String agentId;

    public CoordinationException(String message, String taskId, String agentId) {
        super(message);
        this.taskId = taskId;
        this.agentId = agentId;
    }

    public CoordinationException(String message, String taskId, String agentId, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
        this.agentId = agentId;
    }

    public String taskId() {
        return taskId;
    }

    public String agentId() {
        return agentId;
    }
}
