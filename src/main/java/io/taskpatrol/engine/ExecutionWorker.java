package io.taskpatrol.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskpatrol.checker.CheckContext;
import io.taskpatrol.checker.CheckerException;
import io.taskpatrol.checker.CheckerRegistry;
import io.taskpatrol.checker.ConfigurationException;
import io.taskpatrol.model.ErrorClassification;
import io.taskpatrol.model.ExecutionRequest;
import io.taskpatrol.model.ExecutionStatus;
import io.taskpatrol.model.TaskDefinition;
import io.taskpatrol.notify.NotificationDispatcher;
import io.taskpatrol.observability.AuditLogger;
import io.taskpatrol.security.SecretMaterial;
import io.taskpatrol.security.SensitiveDataMasker;
import io.taskpatrol.storage.CredentialStore;
import io.taskpatrol.storage.ExecutionStore;
import io.taskpatrol.util.Ids;
import io.taskpatrol.vault.CredentialVault;
import io.taskpatrol.vault.VaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one execution request end to end: start under the task lease, resolve the credential, call the
 * checker under a timeout, persist exactly one terminal state together with the lease release, notify.
 */
public final class ExecutionWorker {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionWorker.class);

    private final ExecutionStore store;
    private final CredentialStore credentials;
    private final CredentialVault vault;
    private final CheckerRegistry checkers;
    private final NotificationDispatcher notifications;
    private final AuditLogger audit;
    private final ExecutorService checkerExecutor;
    private final Clock clock;
    private final long leaseTimeoutMs;
    private final long checkerTimeoutMs;

    public ExecutionWorker(ExecutionStore store, CredentialStore credentials, CredentialVault vault, CheckerRegistry checkers,
                           NotificationDispatcher notifications, AuditLogger audit, ExecutorService checkerExecutor,
                           Clock clock, long leaseTimeoutMs, long checkerTimeoutMs) {
        this.store = store;
        this.credentials = credentials;
        this.vault = vault;
        this.checkers = checkers;
        this.notifications = notifications;
        this.audit = audit;
        this.checkerExecutor = checkerExecutor;
        this.clock = clock;
        this.leaseTimeoutMs = leaseTimeoutMs;
        this.checkerTimeoutMs = checkerTimeoutMs;
    }

    public WorkerOutcome process(ExecutionRequest request, String workerId) {
        String executionId = request.executionId();
        String token = Ids.leaseToken();
        long startedAt = clock.millis();
        ExecutionStore.StartResult start = store.startExecution(executionId, workerId, token, startedAt, startedAt + leaseTimeoutMs);

        switch (start.outcome()) {
            case NOT_QUEUED -> {
                logger.warn("Rejecting redelivered request for execution {}: no longer queued", executionId);
                audit.log(AuditLogger.AuditEvent.of("execution.redelivery_rejected", workerId, request.tenantId(),
                        request.taskId(), executionId, "rejected", Map.of()));
                return WorkerOutcome.redelivery(executionId);
            }
            case LEASE_CONFLICT -> {
                logger.warn("Execution {} failed: task {} lease held by execution {}", executionId, start.taskId(),
                        start.leaseOwnerExecutionId());
                audit.log(AuditLogger.AuditEvent.of("execution.conflict", workerId, request.tenantId(), start.taskId(),
                        executionId, "failed", start.leaseOwnerExecutionId() == null
                                ? Map.of() : Map.of("lease_execution_id", start.leaseOwnerExecutionId())));
                notifications.dispatch(request.tenantId(), executionId, ExecutionStatus.FAILED);
                return WorkerOutcome.terminal(executionId, ExecutionStatus.FAILED, ErrorClassification.CONCURRENCY_CONFLICT);
            }
            case STARTED -> {
            }
        }

        String taskId = start.taskId();
        audit.log(AuditLogger.AuditEvent.of("execution.start", workerId, request.tenantId(), taskId, executionId,
                "running", Map.of("trigger_reason", request.triggerReason())));
        for (String superseded : start.supersededExecutionIds()) {
            logger.warn("Execution {} of task {} flagged stale; its lease had lapsed", superseded, taskId);
            audit.log(AuditLogger.AuditEvent.of("execution.stale", workerId, request.tenantId(), taskId, superseded,
                    "stale", Map.of("superseded_by", executionId)));
            notifications.dispatch(request.tenantId(), superseded, ExecutionStatus.STALE);
        }

        Attempt attempt;
        try {
            attempt = run(executionId, taskId, request.tenantId(), request.credentialId());
        } catch (RuntimeException e) {
            logger.error("Execution {} of task {} aborted", executionId, taskId, e);
            attempt = Attempt.failure(ErrorClassification.SERVICE_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        try {
            return persist(request.tenantId(), taskId, executionId, workerId, token, attempt);
        } catch (RuntimeException e) {
            // terminal writes drop the lease themselves; this only runs when the write never committed
            if (!store.releaseLease(taskId, token)) {
                logger.debug("Lease for task {} was no longer held by execution {}", taskId, executionId);
            }
            throw e;
        }
    }

    /**
     * Settles a request whose processing threw before reaching a terminal state. A still-queued
     * execution is failed with {@code ServiceError} and the tenant notified; anything further along is
     * left to lease expiry and stale reconciliation. Either way the claim is not worth redelivering.
     */
    public WorkerOutcome abandon(ExecutionRequest request, String workerId, RuntimeException cause) {
        String executionId = request.executionId();
        String detail = SensitiveDataMasker.errorDetail(
                "Worker failed before the execution started: " + cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                ExecutionDispatcher.MAX_ERROR_DETAIL_CHARS);
        if (!store.failQueued(executionId, ErrorClassification.SERVICE_ERROR, detail, clock.millis())) {
            logger.warn("Execution {} was past queued when its worker failed; leaving it to stale reconciliation", executionId);
            return WorkerOutcome.redelivery(executionId);
        }
        store.releaseLeaseOf(executionId);
        logger.warn("Execution {} of task {} failed: {}", executionId, request.taskId(), detail);
        audit.log(AuditLogger.AuditEvent.of("execution.failed", workerId, request.tenantId(), request.taskId(), executionId,
                "failed", Map.of("classification", ErrorClassification.SERVICE_ERROR.wireName(), "detail", detail)));
        notifications.dispatch(request.tenantId(), executionId, ExecutionStatus.FAILED);
        return WorkerOutcome.terminal(executionId, ExecutionStatus.FAILED, ErrorClassification.SERVICE_ERROR);
    }

    private Attempt run(String executionId, String taskId, String tenantId, String credentialOverride) {
        Optional<TaskDefinition> found = store.findTask(taskId);
        if (found.isEmpty()) {
            return Attempt.failure(ErrorClassification.CONFIGURATION_ERROR, "Task definition " + taskId + " no longer exists");
        }
        TaskDefinition task = found.get();

        String credentialId = credentialOverride != null ? credentialOverride
                : task.credentialId() != null ? task.credentialId()
                : credentials.findDefaultCredentialId(tenantId).orElse(null);
        if (credentialId == null) {
            return Attempt.failure(ErrorClassification.AUTHENTICATION_ERROR,
                    "No credential referenced by task and no default credential for tenant " + tenantId);
        }

        try (SecretMaterial secret = vault.resolve(credentialId)) {
            Optional<CheckerRegistry.BoundCheck> bound = checkers.lookup(task.serviceCategory(), task.operation());
            if (bound.isEmpty()) {
                return Attempt.failure(ErrorClassification.SERVICE_ERROR,
                        "unsupported operation " + task.serviceCategory() + "/" + task.operation());
            }
            try {
                bound.get().validate(task.configuration());
            } catch (ConfigurationException e) {
                return Attempt.failure(ErrorClassification.CONFIGURATION_ERROR, e.getMessage());
            }
            CheckContext ctx = new CheckContext(executionId, taskId, tenantId, task.configuration(), secret);
            return invoke(bound.get(), ctx);
        } catch (VaultException e) {
            logger.warn("Credential {} unusable for execution {}: {}", credentialId, executionId, e.reason());
            return Attempt.failure(ErrorClassification.AUTHENTICATION_ERROR, e.getMessage());
        }
    }

    private Attempt invoke(CheckerRegistry.BoundCheck bound, CheckContext ctx) {
        Future<JsonNode> future;
        try {
            future = checkerExecutor.submit(() -> bound.invoke(ctx));
        } catch (RejectedExecutionException e) {
            return Attempt.failure(ErrorClassification.SERVICE_LIMIT_ERROR, "No checker capacity available: " + e.getMessage());
        }
        try {
            JsonNode payload = future.get(checkerTimeoutMs, TimeUnit.MILLISECONDS);
            if (payload == null || payload.isMissingNode() || payload.isNull()) {
                return Attempt.failure(ErrorClassification.SERVICE_ERROR, "Checker returned no result");
            }
            return Attempt.success(payload);
        } catch (TimeoutException e) {
            future.cancel(true);
            return Attempt.failure(ErrorClassification.SERVICE_LIMIT_ERROR,
                    "Checker " + bound.checker().category() + "/" + bound.operation() + " timed out after " + checkerTimeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof CheckerException checkerFailure) {
                return Attempt.failure(checkerFailure.classification(), checkerFailure.getMessage());
            }
            logger.error("Checker {}/{} crashed for execution {}", bound.checker().category(), bound.operation(),
                    ctx.executionId(), cause);
            return Attempt.failure(ErrorClassification.SERVICE_ERROR, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Attempt.failure(ErrorClassification.SERVICE_ERROR, "Worker interrupted while waiting for the checker");
        }
    }

    private WorkerOutcome persist(String tenantId, String taskId, String executionId, String workerId, String token, Attempt attempt) {
        long now = clock.millis();
        if (attempt.payload() != null) {
            if (!store.completeSuccess(executionId, token, attempt.payload(), now)) {
                return fenced(executionId, taskId);
            }
            logger.info("Execution {} of task {} succeeded", executionId, taskId);
            audit.log(AuditLogger.AuditEvent.of("execution.succeeded", workerId, tenantId, taskId, executionId, "succeeded", Map.of()));
            notifications.dispatch(tenantId, executionId, ExecutionStatus.SUCCEEDED);
            return WorkerOutcome.terminal(executionId, ExecutionStatus.SUCCEEDED, null);
        }

        String detail = SensitiveDataMasker.errorDetail(attempt.detail(), ExecutionDispatcher.MAX_ERROR_DETAIL_CHARS);
        if (!store.completeFailure(executionId, token, attempt.classification(), detail, now)) {
            return fenced(executionId, taskId);
        }
        logger.warn("Execution {} of task {} failed: {} - {}", executionId, taskId, attempt.classification().wireName(), detail);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("classification", attempt.classification().wireName());
        details.put("detail", detail == null ? "" : detail);
        audit.log(AuditLogger.AuditEvent.of("execution.failed", workerId, tenantId, taskId, executionId, "failed", details));
        notifications.dispatch(tenantId, executionId, ExecutionStatus.FAILED);
        return WorkerOutcome.terminal(executionId, ExecutionStatus.FAILED, attempt.classification());
    }

    private WorkerOutcome fenced(String executionId, String taskId) {
        logger.warn("Fenced commit for execution {} of task {}: lease token superseded, outcome discarded", executionId, taskId);
        return WorkerOutcome.fenced(executionId);
    }

    private record Attempt(JsonNode payload, ErrorClassification classification, String detail) {
        static Attempt success(JsonNode payload) {
            return new Attempt(payload, null, null);
        }

        static Attempt failure(ErrorClassification classification, String detail) {
            return new Attempt(null, classification, detail);
        }
    }
}
