package io.taskmesh.model;

public record AgentRecord(
        String agentId,
        AgentRole role,
        SkillLevel skillLevel,
        long registeredAtMs,
        long lastSeenAtMs
) {
}
