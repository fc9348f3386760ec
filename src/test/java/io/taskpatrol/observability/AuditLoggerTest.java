package io.taskpatrol.observability;

import io.taskpatrol.TestClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void chainSurvivesReopenAndMasksSecrets() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            TestClock clock = new TestClock(Instant.parse("2026-01-01T00:00:00Z"));
            AuditLogger audit = new AuditLogger(file, clock);
            audit.log(AuditLogger.AuditEvent.of("credential.create", "operator", "tenant-a", null, null, "ok",
                    Map.of("name", "main", "secret_access_key", "wJalrXUtnFEMI")));
            audit.log(AuditLogger.AuditEvent.of("task.create", "operator", "tenant-a", "tsk_1", null, "ok", null));

            String head = audit.currentHash();
            AuditLogger reopened = new AuditLogger(file, clock);
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("task.delete", "operator", "tenant-a", "tsk_1", null, "ok", Map.of()));

            AuditLogger.ChainVerification verification = reopened.verify();
            Assertions.assertTrue(verification.valid(), verification.problem());
            Assertions.assertEquals(3, verification.rows());
            String content = Files.readString(file, StandardCharsets.UTF_8);
            Assertions.assertFalse(content.contains("wJalrXUtnFEMI"));
            Assertions.assertTrue(content.contains("\"name\":\"main\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksTheChain() throws Exception {
        Path root = Files.createTempDirectory("taskpatrol-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger audit = new AuditLogger(file);
            audit.log(AuditLogger.AuditEvent.of("execution.succeeded", "w1", "tenant-a", "tsk_1", "exe_1", "succeeded", Map.of()));
            audit.log(AuditLogger.AuditEvent.of("execution.failed", "w1", "tenant-a", "tsk_1", "exe_2", "failed", Map.of()));

            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(0, lines.get(0).replace("\"succeeded\"", "\"failed\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.ChainVerification verification = new AuditLogger(file).verify();
            Assertions.assertFalse(verification.valid());
            Assertions.assertEquals(1, verification.rows());

            lines.remove(0);
            Files.write(file, lines, StandardCharsets.UTF_8);
            AuditLogger.ChainVerification truncated = new AuditLogger(file).verify();
            Assertions.assertFalse(truncated.valid());
            Assertions.assertTrue(truncated.problem().contains("prev_hash"));
        } finally {
            deleteRecursively(root);
        }
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
