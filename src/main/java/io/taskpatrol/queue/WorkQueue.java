package io.taskpatrol.queue;

import io.taskpatrol.model.ExecutionRequest;

import java.util.Optional;

/**
 * Durable at-least-once hand-off between the scheduler and the workers. A claimed request stays
 * owned by its worker until it is acknowledged or rejected; unfinished claims come back through
 * {@link #recoverOrphans()}.
 */
public interface WorkQueue {
    EnqueueResult enqueue(ExecutionRequest request);

    /**
     * Blocks until a request can be claimed for {@code workerId}.
     */
    ClaimedRequest dequeue(String workerId) throws InterruptedException;

    Optional<ClaimedRequest> poll(String workerId);

    void acknowledge(ClaimedRequest claimed);

    void reject(ClaimedRequest claimed);

    int recoverOrphans();

    int depth();
}
