package io.taskmesh.coordination;

import io.taskmesh.model.AgentRole;
import io.taskmesh.model.SkillLevel;
import io.taskmesh.model.TaskRecord;
import io.taskmesh.model.TaskStatus;

import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the best task for an agent from a pool. Stateless; the pool must be read from the
 * store right before each call.
 */
public final class TaskMatcher {
    private TaskMatcher() {
    }

    public static boolean eligible(TaskRecord task, AgentRole role, SkillLevel level) {
        return task.targetRole() == role
                && task.status() == TaskStatus.CREATED
                && task.lockedBy() == null
                && level.canTake(task.skillLevel());
    }

    /**
     * Oldest eligible task first. At equal age an exact level match beats a task from a lower
     * level, so senior agents do not drain junior work they merely qualify for.
     */
    public static Optional<TaskRecord> findEligible(AgentRole role, SkillLevel level, Collection<TaskRecord> pool) {
        if (role == null || level == null || pool == null) {
            return Optional.empty();
        }
        Comparator<TaskRecord> order = Comparator
                .comparingLong(TaskRecord::createdAtMs)
                .thenComparingInt(t -> t.skillLevel() == level ? 0 : 1)
                .thenComparing(TaskRecord::taskId);
        return pool.stream()
                .filter(t -> eligible(t, role, level))
                .min(order);
    }
}
