package com.chartbot.model;

import java.time.Duration;
import java.util.Locale;

/**
 * Supported automation cadences.
 */
public enum Frequency {
    FIFTEEN_MINUTES("15m", Duration.ofMinutes(15)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    FOUR_HOURS("4h", Duration.ofHours(4)),
    ONE_DAY("1d", Duration.ofDays(1)),
    ONE_WEEK("1w", Duration.ofDays(7));

    private final String label;
    private final Duration interval;

    Frequency(String label, Duration interval) {
        this.label = label;
        this.interval = interval;
    }

    public String label() {
        return label;
    }

    public Duration interval() {
        return interval;
    }

    public static Frequency fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("frequency must not be empty");
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (Frequency frequency : values()) {
            if (frequency.label.equals(target)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("unsupported frequency: " + raw.trim()
                + " (allowed: 15m, 1h, 4h, 1d, 1w)");
    }

    public static Duration smallestInterval() {
        Duration min = null;
        for (Frequency frequency : values()) {
            if (min == null || frequency.interval.compareTo(min) < 0) {
                min = frequency.interval;
            }
        }
        return min;
    }
}
