package io.taskpatrol.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskpatrol.security.SensitiveDataMasker;
import io.taskpatrol.util.Hashing;
import io.taskpatrol.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row, so truncation or
 * editing shows up in {@link #verify()}.
 */
public final class AuditLogger {
    private static final Logger logger = LoggerFactory.getLogger(AuditLogger.class);
    private final Path auditFile;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile) {
        this(auditFile, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    logger.debug("Audit log {} created concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.ofEpochMilli(clock.millis()).toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("tenant_id", event.tenantId());
        row.put("task_id", event.taskId());
        row.put("execution_id", event.executionId());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Re-walks the chain from the first row.
     */
    @SuppressWarnings("unchecked")
    public synchronized ChainVerification verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        String expectedPrev = "";
        int rows = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            rows++;
            JsonNode node = Jsons.parse(line);
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return new ChainVerification(false, rows, "prev_hash mismatch at row " + rows);
            }
            Map<String, Object> unsigned = Jsons.mapper().convertValue(node, LinkedHashMap.class);
            unsigned.remove("hash");
            if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(unsigned)))) {
                return new ChainVerification(false, rows, "hash mismatch at row " + rows);
            }
            expectedPrev = hash;
        }
        return new ChainVerification(true, rows, null);
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.parse(last).path("hash").asText("");
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Audit log {} has an unreadable tail, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, Map.class);
    }

    public record AuditEvent(
            String action,
            String actor,
            String tenantId,
            String taskId,
            String executionId,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String tenantId, String taskId, String executionId,
                                    String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, tenantId, taskId, executionId, result, details == null ? Map.of() : details);
        }
    }

    public record ChainVerification(boolean valid, int rows, String problem) {
    }
}
