package io.taskpatrol.queue;

import io.taskpatrol.model.ExecutionRequest;

import java.nio.file.Path;

public record ClaimedRequest(ExecutionRequest request, String workerId, Path processingFile) {
}
