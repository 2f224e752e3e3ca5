package io.taskmesh.agent;

import io.taskmesh.model.TaskRecord;

/**
 * @param resumed true when the task came from the recovery journal rather than a fresh match
 */
public record TaskContext(
        String agentId,
        TaskRecord task,
        String executionContext,
        boolean resumed
) {
}
