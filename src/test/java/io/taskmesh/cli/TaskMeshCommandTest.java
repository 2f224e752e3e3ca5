package io.taskmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class TaskMeshCommandTest {

    @Test
    void lockRaceIsVisibleThroughExitCodes() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-cli-lock-");
        try {
            String r = root.toString();
            Assertions.assertEquals(0, run("--root", r, "init").exitCode);
            Assertions.assertEquals(0, run("--root", r, "register", "--agent", "pm-1", "--role", "pm", "--level", "senior").exitCode);

            Result created = run("--root", r, "create-task", "--title", "Add search", "--role", "backend_dev",
                    "--level", "junior", "--creator", "pm-1");
            Assertions.assertEquals(0, created.exitCode);
            JsonNode task = Jsons.mapper().readTree(created.out);
            Assertions.assertEquals("CREATED", task.path("status").asText());
            String taskId = task.path("taskId").asText();

            Result next = run("--root", r, "next-task", "--role", "backend_dev", "--level", "senior", "--wait-ms", "0");
            Assertions.assertEquals(0, next.exitCode);
            JsonNode outcome = Jsons.mapper().readTree(next.out);
            Assertions.assertEquals("MATCHED", outcome.path("kind").asText());
            Assertions.assertEquals(taskId, outcome.path("task").path("taskId").asText());

            Result first = run("--root", r, "lock", "--task", taskId, "--agent", "dev-a");
            Assertions.assertEquals(0, first.exitCode);
            Assertions.assertTrue(Jsons.mapper().readTree(first.out).path("granted").asBoolean());

            Result second = run("--root", r, "lock", "--task", taskId, "--agent", "dev-b");
            Assertions.assertEquals(TaskMeshCommand.EXIT_ALREADY_LOCKED, second.exitCode);
            Assertions.assertEquals("dev-a", Jsons.mapper().readTree(second.out).path("holder").asText());

            Result wrongHolder = run("--root", r, "set-status", "--task", taskId, "--agent", "dev-b", "--status", "dev_done");
            Assertions.assertEquals(TaskMeshCommand.EXIT_REJECTED, wrongHolder.exitCode);

            Result done = run("--root", r, "set-status", "--task", taskId, "--agent", "dev-a", "--status", "DEV_DONE");
            Assertions.assertEquals(0, done.exitCode);
            Assertions.assertEquals("DEV_DONE", Jsons.mapper().readTree(done.out).path("status").asText());

            Result verify = run("--root", r, "audit-verify");
            Assertions.assertEquals(0, verify.exitCode);
            Assertions.assertTrue(Jsons.mapper().readTree(verify.out).path("valid").asBoolean());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidInputIsRejectedWithoutStackTrace() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-cli-invalid-");
        try {
            String r = root.toString();
            Assertions.assertEquals(TaskMeshCommand.EXIT_REJECTED,
                    run("--root", r, "register", "--agent", "x", "--role", "designer").exitCode);
            Assertions.assertEquals(TaskMeshCommand.EXIT_REJECTED,
                    run("--root", r, "set-status", "--task", "tsk_missing", "--agent", "x", "--status", "DEV_DONE").exitCode);
            Assertions.assertEquals(1, run("--root", r, "task", "tsk_missing").exitCode);
            Assertions.assertEquals(2, run("--root", r, "lock", "--task", "tsk_missing").exitCode);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stagedTaskNeedsPromotion() throws Exception {
        Path root = Files.createTempDirectory("taskmesh-test-cli-promote-");
        try {
            String r = root.toString();
            run("--root", r, "register", "--agent", "arch-1", "--role", "architect", "--level", "principal");
            Result created = run("--root", r, "create-task", "--title", "Schema review", "--role", "backend_dev",
                    "--creator", "arch-1", "--stage");
            JsonNode task = Jsons.mapper().readTree(created.out);
            Assertions.assertEquals("PENDING", task.path("status").asText());
            String taskId = task.path("taskId").asText();

            Assertions.assertEquals(TaskMeshCommand.EXIT_REJECTED,
                    run("--root", r, "promote", "--task", taskId, "--actor", "someone").exitCode);
            Result promoted = run("--root", r, "promote", "--task", taskId, "--actor", "arch-1");
            Assertions.assertEquals(0, promoted.exitCode);
            Assertions.assertEquals("CREATED", Jsons.mapper().readTree(promoted.out).path("status").asText());

            Result listed = run("--root", r, "tasks", "--status", "created");
            Assertions.assertEquals(1, Jsons.mapper().readTree(listed.out).size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Result run(String... args) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (PrintStream capture = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            System.setOut(capture);
            int exit = TaskMeshCommand.commandLine().execute(args);
            return new Result(exit, buffer.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(original);
        }
    }

    private record Result(int exitCode, String out) {
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
