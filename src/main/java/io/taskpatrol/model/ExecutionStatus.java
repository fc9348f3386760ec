package io.taskpatrol.model;

public enum ExecutionStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    STALE;

    public boolean terminal() {
        return this == SUCCEEDED || this == FAILED || this == STALE;
    }
}
