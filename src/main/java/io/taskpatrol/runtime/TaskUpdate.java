package io.taskpatrol.runtime;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Partial update; null fields keep their current value. {@code clearCredential} drops the credential
 * reference so the tenant default applies.
 */
public record TaskUpdate(
        String name,
        String serviceCategory,
        String operation,
        JsonNode configuration,
        String frequency,
        Boolean active,
        String credentialId,
        boolean clearCredential
) {
}
