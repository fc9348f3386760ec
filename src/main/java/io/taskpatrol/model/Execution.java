package io.taskpatrol.model;

public record Execution(
        String executionId,
        String taskId,
        String tenantId,
        TriggerReason triggerReason,
        ExecutionStatus status,
        long queuedAtMs,
        Long startedAtMs,
        Long finishedAtMs,
        int attempt,
        ErrorClassification errorClassification,
        String errorDetail,
        String leaseHolder
) {
}
