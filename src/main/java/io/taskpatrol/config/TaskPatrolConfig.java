package io.taskpatrol.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TaskPatrolConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "taskpatrol-settings.json";

    private final Path rootDir;

    public TaskPatrolConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TaskPatrolConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new TaskPatrolConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("taskpatrol.db");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path queueRoot() {
        return rootDir.resolve("queue");
    }

    public Path inboxDir() {
        return queueRoot().resolve("inbox");
    }

    public Path processingDir() {
        return queueRoot().resolve("processing");
    }

    public Path doneRoot() {
        return queueRoot().resolve("done");
    }

    public Path deadRoot() {
        return queueRoot().resolve("dead");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path credentialKeyFile() {
        return securityRoot().resolve("credential-keys.json");
    }
}
