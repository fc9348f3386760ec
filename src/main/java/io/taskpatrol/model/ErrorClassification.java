package io.taskpatrol.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of failure categories attached to a failed execution. The wire name is the stable
 * contract exposed to tenants and persisted in the store.
 */
public enum ErrorClassification {
    AUTHENTICATION_ERROR("AuthenticationError"),
    PERMISSION_ERROR("PermissionError"),
    SERVICE_LIMIT_ERROR("ServiceLimitError"),
    SERVICE_ERROR("ServiceError"),
    CONCURRENCY_CONFLICT("ConcurrencyConflict"),
    CONFIGURATION_ERROR("ConfigurationError");

    private final String wireName;

    ErrorClassification(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static ErrorClassification fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (ErrorClassification value : values()) {
            if (value.wireName.equals(raw) || value.name().equals(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown error classification: " + raw);
    }
}
