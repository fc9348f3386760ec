package io.taskpatrol.model;

public enum TriggerReason {
    SCHEDULED,
    MANUAL;

    public static TriggerReason fromString(String raw) {
        for (TriggerReason value : values()) {
            if (value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown trigger reason: " + raw);
    }
}
