package io.taskpatrol.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.taskpatrol.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code taskpatrol-settings.json} under the data root. Every field is optional;
 * missing or non-positive values fall back to the defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineSettings(
        long tickIntervalMs,
        long reconcileIntervalMs,
        int workerThreads,
        long leaseTimeoutMs,
        long checkerTimeoutMs,
        long queuePollIntervalMs,
        String remoteEndpoint,
        String defaultRegion,
        String notifierWebhookUrl
) {
    public static final long DEFAULT_TICK_INTERVAL_MS = 60_000L;
    public static final long DEFAULT_RECONCILE_INTERVAL_MS = 60_000L;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final long DEFAULT_LEASE_TIMEOUT_MS = 15L * 60_000L;
    public static final long DEFAULT_CHECKER_TIMEOUT_MS = 5L * 60_000L;
    public static final long DEFAULT_QUEUE_POLL_INTERVAL_MS = 500L;
    public static final String DEFAULT_REMOTE_ENDPOINT = "https://inspect.invalid";
    public static final String DEFAULT_REGION = "us-east-1";

    public EngineSettings {
        tickIntervalMs = tickIntervalMs > 0 ? tickIntervalMs : DEFAULT_TICK_INTERVAL_MS;
        reconcileIntervalMs = reconcileIntervalMs > 0 ? reconcileIntervalMs : DEFAULT_RECONCILE_INTERVAL_MS;
        workerThreads = workerThreads > 0 ? workerThreads : DEFAULT_WORKER_THREADS;
        leaseTimeoutMs = leaseTimeoutMs > 0 ? leaseTimeoutMs : DEFAULT_LEASE_TIMEOUT_MS;
        checkerTimeoutMs = checkerTimeoutMs > 0 ? checkerTimeoutMs : DEFAULT_CHECKER_TIMEOUT_MS;
        queuePollIntervalMs = queuePollIntervalMs > 0 ? queuePollIntervalMs : DEFAULT_QUEUE_POLL_INTERVAL_MS;
        remoteEndpoint = remoteEndpoint == null || remoteEndpoint.isBlank() ? DEFAULT_REMOTE_ENDPOINT : remoteEndpoint.trim();
        defaultRegion = defaultRegion == null || defaultRegion.isBlank() ? DEFAULT_REGION : defaultRegion.trim();
        notifierWebhookUrl = notifierWebhookUrl == null ? "" : notifierWebhookUrl.trim();
        if (leaseTimeoutMs <= checkerTimeoutMs) {
            throw new IllegalArgumentException(
                    "leaseTimeoutMs (" + leaseTimeoutMs + ") must exceed checkerTimeoutMs (" + checkerTimeoutMs + ")");
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(0L, 0L, 0, 0L, 0L, 0L, null, null, null);
    }

    public static EngineSettings load(TaskPatrolConfig config) {
        return load(config.settingsFile());
    }

    public static EngineSettings load(Path file) {
        if (!Files.exists(file)) {
            return defaults();
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Settings file must contain a JSON object: " + file);
            }
            return Jsons.mapper().treeToValue(node, EngineSettings.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }
}
