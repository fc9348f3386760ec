package io.taskpatrol.engine;

import io.taskpatrol.model.TaskDefinition;
import io.taskpatrol.model.TriggerReason;
import io.taskpatrol.storage.ExecutionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Time-based sweep over active tasks. A task is due when {@code now >= last_trigger + period}; each due
 * task yields at most one queued execution per tick, and {@code last_trigger} only moves once the
 * request is safely in the queue.
 */
public final class Scheduler {
    private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);
    static final String HOLDER = "scheduler";

    private final ExecutionStore store;
    private final ExecutionDispatcher dispatcher;
    private final Clock clock;

    public Scheduler(ExecutionStore store, ExecutionDispatcher dispatcher, Clock clock) {
        this.store = store;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    public TickSummary tick() {
        return tick(clock.instant());
    }

    public TickSummary tick(Instant now) {
        long nowMs = now.toEpochMilli();
        int scanned = 0;
        int due = 0;
        int enqueued = 0;
        int skipped = 0;
        int failed = 0;
        for (TaskDefinition task : store.listActiveScheduledTasks()) {
            scanned++;
            if (!isDue(task, nowMs)) {
                continue;
            }
            due++;
            try {
                ExecutionDispatcher.DispatchOutcome outcome = dispatcher.dispatch(task, TriggerReason.SCHEDULED, HOLDER, nowMs);
                switch (outcome.disposition()) {
                    case ENQUEUED -> {
                        store.stampLastTrigger(task.taskId(), nowMs);
                        enqueued++;
                    }
                    case SKIPPED -> skipped++;
                    case CONFLICT, FAILED -> failed++;
                }
            } catch (RuntimeException e) {
                failed++;
                logger.error("Scheduling task {} failed", task.taskId(), e);
            }
        }
        TickSummary summary = new TickSummary(scanned, due, enqueued, skipped, failed);
        if (due > 0) {
            logger.info("Scheduler tick: {}", summary);
        } else {
            logger.debug("Scheduler tick: {}", summary);
        }
        return summary;
    }

    static boolean isDue(TaskDefinition task, long nowMs) {
        if (!task.active()) {
            return false;
        }
        return task.frequency().period()
                .map(Duration::toMillis)
                .map(period -> nowMs >= task.lastTriggerAtMs() + period)
                .orElse(false);
    }
}
