package io.taskmesh.model;

/**
 * Creation request for a task. {@code staged} asks a privileged creator's task to start
 * in {@link TaskStatus#PENDING}; non-privileged creators are always staged.
 */
public record NewTask(
        String featureId,
        String title,
        String description,
        AgentRole targetRole,
        SkillLevel skillLevel,
        Complexity complexity,
        String branch,
        boolean staged
) {
    public NewTask {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        if (targetRole == null) {
            throw new IllegalArgumentException("targetRole must not be null");
        }
        if (skillLevel == null) {
            throw new IllegalArgumentException("skillLevel must not be null");
        }
        if (complexity == null) {
            complexity = Complexity.MINOR;
        }
    }
}
