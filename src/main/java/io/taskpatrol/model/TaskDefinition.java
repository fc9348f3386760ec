package io.taskpatrol.model;

import com.fasterxml.jackson.databind.JsonNode;

public record TaskDefinition(
        String taskId,
        String tenantId,
        String name,
        String serviceCategory,
        String operation,
        JsonNode configuration,
        Frequency frequency,
        boolean active,
        String credentialId,
        long createdAtMs,
        long updatedAtMs,
        long lastTriggerAtMs
) {
}
