package io.taskpatrol.runtime;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Input for a new task definition. {@code frequency} defaults to daily and {@code credentialId} may be
 * null to fall back to the tenant's default credential at execution time.
 */
public record TaskSpec(
        String tenantId,
        String name,
        String serviceCategory,
        String operation,
        JsonNode configuration,
        String frequency,
        boolean active,
        String credentialId
) {
}
