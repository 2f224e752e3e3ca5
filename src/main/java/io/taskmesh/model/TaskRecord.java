package io.taskmesh.model;

public record TaskRecord(
        String taskId,
        String featureId,
        String title,
        String description,
        AgentRole targetRole,
        SkillLevel skillLevel,
        Complexity complexity,
        TaskStatus status,
        String lockedBy,
        Long lockedAtMs,
        long lockEpoch,
        String executionContext,
        String branch,
        String notes,
        String createdBy,
        long createdAtMs,
        long updatedAtMs
) {
    public boolean heldBy(String agentId) {
        return status.held() && lockedBy != null && lockedBy.equals(agentId);
    }
}
