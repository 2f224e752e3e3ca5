package io.taskmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TaskMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "taskmesh-settings.json";

    private final Path rootDir;

    public TaskMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TaskMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new TaskMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("taskmesh.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path journalDir() {
        return rootDir.resolve("journal");
    }

    public Path brokerDir() {
        return rootDir.resolve("broker");
    }

    public Path brokerStateFile() {
        return brokerDir().resolve("interest.json");
    }

    public Path brokerLockFile() {
        return brokerDir().resolve("interest.lock");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
