package io.taskpatrol.engine;

import io.taskpatrol.model.ErrorClassification;
import io.taskpatrol.model.ExecutionRequest;
import io.taskpatrol.model.ExecutionStatus;
import io.taskpatrol.model.Lease;
import io.taskpatrol.model.TaskDefinition;
import io.taskpatrol.model.TriggerReason;
import io.taskpatrol.notify.NotificationDispatcher;
import io.taskpatrol.observability.AuditLogger;
import io.taskpatrol.queue.EnqueueResult;
import io.taskpatrol.queue.WorkQueue;
import io.taskpatrol.security.SensitiveDataMasker;
import io.taskpatrol.storage.ExecutionStore;
import io.taskpatrol.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Turns a task into a queued execution: lease, execution row, queue hand-off. Shared by the scheduler
 * and manual triggers, which differ only in what happens when the task's lease is already held.
 */
public final class ExecutionDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionDispatcher.class);
    static final int MAX_ERROR_DETAIL_CHARS = 2000;

    private final ExecutionStore store;
    private final WorkQueue queue;
    private final NotificationDispatcher notifications;
    private final AuditLogger audit;
    private final long leaseTimeoutMs;

    public ExecutionDispatcher(ExecutionStore store, WorkQueue queue, NotificationDispatcher notifications,
                               AuditLogger audit, long leaseTimeoutMs) {
        this.store = store;
        this.queue = queue;
        this.notifications = notifications;
        this.audit = audit;
        this.leaseTimeoutMs = leaseTimeoutMs;
    }

    public DispatchOutcome dispatch(TaskDefinition task, TriggerReason reason, String holder, long nowMs) {
        return dispatch(task, reason, holder, nowMs, null);
    }

    /**
     * @param credentialOverride credential to run with instead of the task's own, or null
     */
    public DispatchOutcome dispatch(TaskDefinition task, TriggerReason reason, String holder, long nowMs, String credentialOverride) {
        String executionId = Ids.executionId();
        String token = Ids.leaseToken();
        boolean leased = store.tryAcquireLease(task.taskId(), executionId, holder, token, nowMs, nowMs + leaseTimeoutMs);
        if (!leased) {
            return reason == TriggerReason.SCHEDULED
                    ? skip(task)
                    : recordConflict(task, executionId, reason, nowMs);
        }

        try {
            store.insertQueuedExecution(new ExecutionStore.NewExecution(executionId, task.taskId(), task.tenantId(), reason, nowMs));
        } catch (RuntimeException e) {
            store.releaseLease(task.taskId(), token);
            throw e;
        }

        ExecutionRequest request = new ExecutionRequest(executionId, task.taskId(), task.tenantId(), reason.name(), nowMs,
                credentialOverride);
        EnqueueResult enqueued = queue.enqueue(request);
        if (enqueued.ok()) {
            audit.log(AuditLogger.AuditEvent.of("scheduler.enqueue", holder, task.tenantId(), task.taskId(), executionId,
                    "ok", Map.of("trigger_reason", reason.name())));
            logger.info("Queued execution {} for task {} ({})", executionId, task.taskId(), reason);
            return DispatchOutcome.enqueued(executionId);
        }

        String detail = SensitiveDataMasker.errorDetail("Failed to enqueue execution request: " + enqueued.reason(),
                MAX_ERROR_DETAIL_CHARS);
        logger.error("Enqueue failed for task {} execution {}: {}", task.taskId(), executionId, enqueued.reason());
        audit.log(AuditLogger.AuditEvent.of("scheduler.enqueue_failed", holder, task.tenantId(), task.taskId(), executionId,
                "failed", Map.of("reason", detail)));
        boolean failed;
        try {
            failed = store.failQueued(executionId, ErrorClassification.SERVICE_ERROR, detail, nowMs);
        } finally {
            store.releaseLease(task.taskId(), token);
        }
        if (failed) {
            notifications.dispatch(task.tenantId(), executionId, ExecutionStatus.FAILED);
        }
        return DispatchOutcome.failed(executionId);
    }

    private DispatchOutcome skip(TaskDefinition task) {
        String owner = store.findLease(task.taskId()).map(Lease::executionId).orElse(null);
        logger.info("Task {} skipped - still running (execution {})", task.taskId(), owner);
        audit.log(AuditLogger.AuditEvent.of("scheduler.skip", "scheduler", task.tenantId(), task.taskId(), owner,
                "skipped", Map.of("reason", "still running")));
        return DispatchOutcome.skipped(owner);
    }

    private DispatchOutcome recordConflict(TaskDefinition task, String executionId, TriggerReason reason, long nowMs) {
        String owner = store.findLease(task.taskId()).map(Lease::executionId).orElse(null);
        store.insertQueuedExecution(new ExecutionStore.NewExecution(executionId, task.taskId(), task.tenantId(), reason, nowMs));
        boolean failed = store.failQueued(executionId, ErrorClassification.CONCURRENCY_CONFLICT,
                "Task " + task.taskId() + " already has execution " + owner + " in flight", nowMs);
        logger.warn("Execution {} for task {} rejected: execution {} holds the task lease", executionId, task.taskId(), owner);
        audit.log(AuditLogger.AuditEvent.of("execution.conflict", reason.name().toLowerCase(Locale.ROOT), task.tenantId(), task.taskId(),
                executionId, "failed", owner == null ? Map.of() : Map.of("lease_execution_id", owner)));
        if (failed) {
            notifications.dispatch(task.tenantId(), executionId, ExecutionStatus.FAILED);
        }
        return DispatchOutcome.conflict(executionId);
    }

    public enum Disposition {
        ENQUEUED,
        SKIPPED,
        CONFLICT,
        FAILED
    }

    /**
     * {@code executionId} is the new execution, or for {@link Disposition#SKIPPED} the one holding the lease.
     */
    public record DispatchOutcome(Disposition disposition, String executionId) {
        static DispatchOutcome enqueued(String executionId) {
            return new DispatchOutcome(Disposition.ENQUEUED, executionId);
        }

        static DispatchOutcome skipped(String ownerExecutionId) {
            return new DispatchOutcome(Disposition.SKIPPED, ownerExecutionId);
        }

        static DispatchOutcome conflict(String executionId) {
            return new DispatchOutcome(Disposition.CONFLICT, executionId);
        }

        static DispatchOutcome failed(String executionId) {
            return new DispatchOutcome(Disposition.FAILED, executionId);
        }
    }
}
