package io.taskpatrol.storage;

/**
 * Raised when a task cannot be removed because one of its executions still holds the task lease.
 */
public final class TaskBusyException extends RuntimeException {
    public TaskBusyException(String taskId, String executionId) {
        super("Task " + taskId + " has an execution in flight: " + executionId);
    }
}
