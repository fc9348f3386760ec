package io.taskpatrol.checker;

import com.fasterxml.jackson.databind.JsonNode;
import io.taskpatrol.security.SecretMaterial;

public record CheckContext(
        String executionId,
        String taskId,
        String tenantId,
        JsonNode configuration,
        SecretMaterial credentials
) {
    public String text(String field, String fallback) {
        if (configuration == null || !configuration.hasNonNull(field)) {
            return fallback;
        }
        String value = configuration.path(field).asText("");
        return value.isBlank() ? fallback : value.trim();
    }

    public int integer(String field, int fallback) {
        if (configuration == null || !configuration.hasNonNull(field)) {
            return fallback;
        }
        return configuration.path(field).asInt(fallback);
    }

    /**
     * Region override from the task configuration, else the credential's region.
     */
    public String region() {
        return text("region", credentials.region());
    }
}
