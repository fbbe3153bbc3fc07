package com.hearthside.model;

import java.time.Duration;

/**
 * Independent counting windows, in evaluation order.
 */
public enum RateTier {
    MINUTE("per-minute", Duration.ofMinutes(1)),
    HOUR("per-hour", Duration.ofHours(1)),
    DAY("per-day", Duration.ofDays(1));

    private final String label;
    private final Duration length;

    RateTier(String label, Duration length) {
        this.label = label;
        this.length = length;
    }

    public String getLabel() {
        return label;
    }

    public Duration getLength() {
        return length;
    }
}
