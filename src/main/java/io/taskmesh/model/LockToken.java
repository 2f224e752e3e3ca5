package io.taskmesh.model;

public record LockToken(
        String taskId,
        String agentId,
        long lockedAtMs,
        long lockEpoch,
        String executionContext
) {
}
