package io.taskpatrol.notify;

import io.taskpatrol.model.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls the configured {@link Notifier} and contains its failures. A failed delivery is logged and
 * never affects the execution record.
 */
public final class NotificationDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Notifier notifier;

    public NotificationDispatcher(Notifier notifier) {
        this.notifier = notifier;
    }

    public boolean dispatch(String tenantId, String executionId, ExecutionStatus status) {
        if (!status.terminal()) {
            throw new IllegalArgumentException("Only terminal states are notified, got " + status);
        }
        try {
            notifier.notify(tenantId, executionId, status);
            return true;
        } catch (NotificationException | RuntimeException e) {
            logger.error("Notification for execution {} ({}) to tenant {} failed", executionId, status, tenantId, e);
            return false;
        }
    }
}
