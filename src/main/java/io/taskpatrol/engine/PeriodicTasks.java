package io.taskpatrol.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-rate background jobs (scheduler tick, stale reconciliation). A failing run is logged and the
 * next one still fires.
 */
public final class PeriodicTasks {
    private static final Logger logger = LoggerFactory.getLogger(PeriodicTasks.class);

    private final ScheduledThreadPoolExecutor executor;
    private final List<Job> jobs = new ArrayList<>();
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();

    public PeriodicTasks() {
        this.executor = new ScheduledThreadPoolExecutor(2, r -> {
            Thread t = new Thread(r, "taskpatrol-timer");
            t.setDaemon(true);
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
    }

    public void register(String name, long intervalMs, Runnable body) {
        jobs.add(new Job(name, Math.max(1L, intervalMs), body));
    }

    public synchronized void start() {
        for (Job job : jobs) {
            logger.info("Scheduling {} every {}ms", job.name(), job.intervalMs());
            futures.add(executor.scheduleAtFixedRate(() -> runLogged(job), 0, job.intervalMs(), TimeUnit.MILLISECONDS));
        }
    }

    public synchronized void stop() {
        logger.info("Shutting down periodic tasks...");
        for (ScheduledFuture<?> f : futures) {
            f.cancel(true);
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Periodic tasks did not terminate gracefully");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Periodic task shutdown interrupted.");
        }
    }

    private void runLogged(Job job) {
        long start = System.currentTimeMillis();
        try {
            job.body().run();
        } catch (RuntimeException e) {
            logger.error("Error in periodic task {}: {}", job.name(), e.getMessage(), e);
        } finally {
            logger.debug("Periodic task {} took {}ms", job.name(), System.currentTimeMillis() - start);
        }
    }

    private record Job(String name, long intervalMs, Runnable body) {
    }
}
