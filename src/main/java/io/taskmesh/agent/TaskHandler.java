package io.taskmesh.agent;

/**
 * The work an agent does once it holds a task.
 */
public interface TaskHandler {
    String id();

    TaskResult execute(TaskContext context) throws Exception;
}
