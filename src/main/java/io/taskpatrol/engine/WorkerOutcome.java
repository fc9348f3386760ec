package io.taskpatrol.engine;

import io.taskpatrol.model.ErrorClassification;
import io.taskpatrol.model.ExecutionStatus;

/**
 * What one request amounted to. {@code status} is null when this worker wrote no terminal state: a
 * rejected redelivery or a fenced commit.
 */
public record WorkerOutcome(
        String executionId,
        ExecutionStatus status,
        ErrorClassification classification,
        boolean redelivery,
        boolean fenced
) {
    static WorkerOutcome terminal(String executionId, ExecutionStatus status, ErrorClassification classification) {
        return new WorkerOutcome(executionId, status, classification, false, false);
    }

    static WorkerOutcome redelivery(String executionId) {
        return new WorkerOutcome(executionId, null, null, true, false);
    }

    static WorkerOutcome fenced(String executionId) {
        return new WorkerOutcome(executionId, null, null, false, true);
    }
}
