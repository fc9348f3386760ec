package io.taskpatrol.model;

import com.fasterxml.jackson.databind.JsonNode;

public record ExecutionResult(
        String executionId,
        JsonNode payload,
        long producedAtMs
) {
}
