package io.taskpatrol.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Optional;

public enum Frequency {
    DAILY("daily", Duration.ofHours(24)),
    WEEKLY("weekly", Duration.ofDays(7)),
    MONTHLY("monthly", Duration.ofDays(30)),
    ON_DEMAND("on_demand", null);

    private final String wireName;
    private final Duration period;

    Frequency(String wireName, Duration period) {
        this.wireName = wireName;
        this.period = period;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Trigger period for the time-based sweep; empty for {@link #ON_DEMAND}.
     */
    public Optional<Duration> period() {
        return Optional.ofNullable(period);
    }

    public boolean scheduled() {
        return period != null;
    }

    public static Frequency fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return DAILY;
        }
        String normalized = raw.trim().replace('-', '_');
        for (Frequency value : values()) {
            if (value.name().equalsIgnoreCase(normalized) || value.wireName.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown frequency: " + raw);
    }
}
