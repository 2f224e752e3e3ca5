package io.taskmesh.agent;

public record TaskResult(
        boolean success,
        String output,
        String error
) {
    public static TaskResult ok(String output) {
        return new TaskResult(true, output, null);
    }

    public static TaskResult fail(String error) {
        return new TaskResult(false, null, error);
    }
}
