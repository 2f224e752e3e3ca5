package io.taskmesh.agent;

import io.taskmesh.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs an external command per task. The task is passed as JSON on stdin and through
 * {@code TASKMESH_*} environment variables; exit code 0 means success.
 *
 * <p>No timeout here: the worker bounds execution and interrupts this thread when it expires.
 */
public final class ScriptTaskHandler implements TaskHandler {
    private static final int MAX_ERROR_CHARS = 512;

    private final String id;
    private final List<String> command;

    public ScriptTaskHandler(String id, List<String> command) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script handler id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script handler command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public TaskResult execute(TaskContext context) throws InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Map<String, String> env = pb.environment();
        env.put("TASKMESH_TASK_ID", context.task().taskId());
        env.put("TASKMESH_AGENT_ID", context.agentId());
        env.put("TASKMESH_RESUMED", Boolean.toString(context.resumed()));
        if (context.executionContext() != null) {
            env.put("TASKMESH_EXECUTION_CONTEXT", context.executionContext());
            Path dir = Path.of(context.executionContext());
            if (dir.toFile().isDirectory()) {
                pb.directory(dir.toFile());
            }
        }
        Path output;
        try {
            output = Files.createTempFile("taskmesh-script-", ".out");
        } catch (IOException e) {
            return TaskResult.fail("script output file failed: " + e.getMessage());
        }
        pb.redirectOutput(output.toFile());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            deleteQuietly(output);
            return TaskResult.fail("script spawn failed: " + e.getMessage());
        }

        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(Jsons.toCompactJson(context.task()).getBytes(StandardCharsets.UTF_8));
            }
            int exit = process.waitFor();
            String combined = Files.readString(output, StandardCharsets.UTF_8);
            if (exit == 0) {
                return TaskResult.ok(combined.strip());
            }
            return TaskResult.fail("script exit=" + exit + " output=" + truncate(combined));
        } catch (IOException e) {
            process.destroyForcibly();
            return TaskResult.fail("script execution failed: " + e.getMessage());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            deleteQuietly(output);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            file.toFile().deleteOnExit();
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
