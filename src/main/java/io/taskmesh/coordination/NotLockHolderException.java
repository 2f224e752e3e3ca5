package io.taskmesh.coordination;

public final class NotLockHolderException extends CoordinationException {
    private final String actualHolder;

    public NotLockHolderException(String taskId, String agentId, String actualHolder) {
        super("Agent " + agentId + " does not hold the lock on task " + taskId
                + " (holder=" + (actualHolder == null ? "none" : actualHolder) + ")", taskId, agentId);
        this.actualHolder = actualHolder;
    }

    public String actualHolder() {
        return actualHolder;
    }
}
