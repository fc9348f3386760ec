package io.taskpatrol.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Credential metadata safe to show to operators. The sealed secret never leaves the store layer.
 */
public record CredentialView(
        String credentialId,
        String tenantId,
        String name,
        String region,
        @JsonProperty("isDefault") boolean isDefault,
        boolean active,
        long createdAtMs
) {
}
