package io.taskmesh.coordination;

import io.taskmesh.model.TaskStatus;

public final class InvalidTransitionException extends CoordinationException {
    private final TaskStatus current;
    private final TaskStatus requested;

    public InvalidTransitionException(String taskId, String agentId, TaskStatus current, TaskStatus requested, String reason) {
        super("Invalid transition " + current + " -> " + requested + " for task " + taskId
                + (reason == null || reason.isBlank() ? "" : ": " + reason), taskId, agentId);
        this.current = current;
        this.requested = requested;
    }

    public TaskStatus current() {
        return current;
    }

    public TaskStatus requested() {
        return requested;
    }
}
