package io.taskpatrol.model;

/**
 * Queue payload for one execution. {@code credentialId} is a per-run override of the task's credential
 * and is null for scheduled runs.
 */
public record ExecutionRequest(
        String executionId,
        String taskId,
        String tenantId,
        String triggerReason,
        long queuedAtMs,
        String credentialId
) {
}
