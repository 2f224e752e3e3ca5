package io.taskmesh.journal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.taskmesh.model.TaskRecord;
import io.taskmesh.model.TaskStatus;

/**
 * What an agent needs to resume its held task after a crash. Mirrors a subset of the task
 * row as it looked when the lock was granted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JournalEntry(
        String agentId,
        String taskId,
        String title,
        TaskStatus statusAtLock,
        String executionContext,
        String branch,
        long lockedAtMs,
        long lockEpoch,
        long recordedAtMs,
        long updatedAtMs
) {
    public static JournalEntry of(String agentId, TaskRecord task, long nowMs) {
        return new JournalEntry(
                agentId,
                task.taskId(),
                task.title(),
                task.status(),
                task.executionContext(),
                task.branch(),
                task.lockedAtMs() == null ? nowMs : task.lockedAtMs(),
                task.lockEpoch(),
                nowMs,
                nowMs
        );
    }

    public JournalEntry withContext(String newExecutionContext, String newBranch, long nowMs) {
        return new JournalEntry(
                agentId,
                taskId,
                title,
                statusAtLock,
                newExecutionContext == null ? executionContext : newExecutionContext,
                newBranch == null ? branch : newBranch,
                lockedAtMs,
                lockEpoch,
                recordedAtMs,
                nowMs
        );
    }
}
