package io.taskpatrol.engine;

import io.taskpatrol.model.Execution;
import io.taskpatrol.model.ExecutionStatus;
import io.taskpatrol.notify.NotificationDispatcher;
import io.taskpatrol.observability.AuditLogger;
import io.taskpatrol.storage.ExecutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Moves running executions that lost their lease to {@code stale}. Nothing is auto-resolved to
 * succeeded or failed; stale rows wait for an operator.
 */
public final class StaleExecutionReconciler {
    private static final Logger logger = LoggerFactory.getLogger(StaleExecutionReconciler.class);

    private final ExecutionStore store;
    private final NotificationDispatcher notifications;
    private final AuditLogger audit;
    private final Clock clock;

    public StaleExecutionReconciler(ExecutionStore store, NotificationDispatcher notifications, AuditLogger audit, Clock clock) {
        this.store = store;
        this.notifications = notifications;
        this.audit = audit;
        this.clock = clock;
    }

    public List<Execution> reconcile() {
        List<Execution> flagged = store.markStaleExecutions(clock.millis());
        for (Execution execution : flagged) {
            logger.warn("Execution {} of task {} flagged stale: lease lost while running", execution.executionId(),
                    execution.taskId());
            audit.log(AuditLogger.AuditEvent.of("execution.stale", "reconciler", execution.tenantId(), execution.taskId(),
                    execution.executionId(), "stale", Map.of("lease_holder", String.valueOf(execution.leaseHolder()))));
            notifications.dispatch(execution.tenantId(), execution.executionId(), ExecutionStatus.STALE);
        }
        return flagged;
    }
}
