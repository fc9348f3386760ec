package io.taskpatrol.model;

public record Lease(
        String taskId,
        String executionId,
        String holder,
        String token,
        long acquiredAtMs,
        long expiresAtMs
) {
    public boolean expiredAt(long nowMs) {
        return expiresAtMs <= nowMs;
    }
}
