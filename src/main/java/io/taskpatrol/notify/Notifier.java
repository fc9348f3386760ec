package io.taskpatrol.notify;

import io.taskpatrol.model.ExecutionStatus;

/**
 * Tenant-facing delivery of terminal execution states.
 */
public interface Notifier {
    void notify(String tenantId, String executionId, ExecutionStatus status) throws NotificationException;
}
