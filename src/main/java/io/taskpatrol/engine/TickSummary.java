package io.taskpatrol.engine;

public record TickSummary(int scanned, int due, int enqueued, int skipped, int failed) {
}
