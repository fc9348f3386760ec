package io.taskpatrol.engine;

import io.taskpatrol.queue.ClaimedRequest;
import io.taskpatrol.queue.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of worker threads, each looping dequeue, process, acknowledge.
 */
public final class WorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final WorkQueue queue;
    private final ExecutionWorker worker;
    private final int threads;
    private final String workerPrefix;
    private final long retryBackoffMs;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ExecutorService executor;

    public WorkerPool(WorkQueue queue, ExecutionWorker worker, int threads, String workerPrefix, long retryBackoffMs) {
        this.queue = queue;
        this.worker = worker;
        this.threads = Math.max(1, threads);
        this.workerPrefix = workerPrefix == null || workerPrefix.isBlank() ? "worker" : workerPrefix.trim();
        this.retryBackoffMs = Math.max(1L, retryBackoffMs);
    }

    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "taskpatrol-" + workerPrefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 1; i <= threads; i++) {
            String workerId = workerPrefix + "-" + i;
            executor.submit(() -> loop(workerId));
        }
        logger.info("Started {} worker thread(s)", threads);
    }

    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Stopping worker pool...");
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Worker pool did not terminate gracefully");
            } else {
                logger.info("Worker pool stopped.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Worker pool shutdown interrupted.");
        }
    }

    /**
     * Processes requests on the calling thread until the queue is empty or {@code max} requests were
     * handled.
     */
    public List<WorkerOutcome> drain(String workerId, int max) {
        List<WorkerOutcome> outcomes = new ArrayList<>();
        while (outcomes.size() < max) {
            Optional<ClaimedRequest> claimed = queue.poll(workerId);
            if (claimed.isEmpty()) {
                break;
            }
            outcomes.add(handle(claimed.get()));
        }
        return outcomes;
    }

    private void loop(String workerId) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            ClaimedRequest claimed;
            try {
                claimed = queue.dequeue(workerId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                logger.error("Worker {} failed to claim a request, retrying in {}ms", workerId, retryBackoffMs, e);
                if (!pause()) {
                    break;
                }
                continue;
            }
            try {
                handle(claimed);
            } catch (RuntimeException e) {
                // the claim stays under processing/ and is redelivered by recoverOrphans()
                logger.error("Worker {} could not settle execution {}", workerId, claimed.request().executionId(), e);
                if (!pause()) {
                    break;
                }
            }
        }
        logger.debug("Worker {} exiting", workerId);
    }

    private boolean pause() {
        try {
            Thread.sleep(retryBackoffMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private WorkerOutcome handle(ClaimedRequest claimed) {
        WorkerOutcome outcome;
        try {
            outcome = worker.process(claimed.request(), claimed.workerId());
        } catch (RuntimeException e) {
            logger.error("Worker {} failed on execution {}", claimed.workerId(), claimed.request().executionId(), e);
            outcome = worker.abandon(claimed.request(), claimed.workerId(), e);
        }
        if (outcome.redelivery()) {
            queue.reject(claimed);
        } else {
            queue.acknowledge(claimed);
        }
        return outcome;
    }
}
