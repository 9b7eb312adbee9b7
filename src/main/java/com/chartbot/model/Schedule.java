package com.chartbot.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Automation schedule for one chart layout.
 */
@Builder(toBuilder = true)
public final class Schedule {
    public final long id;
    public final String userId;
    public final String layoutId;
    public final boolean enabled;
    public final Frequency frequency;
    public final boolean sendToTelegram;
    public final boolean onlyOnSignalChange;
    public final int minConfidence;
    public final boolean sendOnHold;
    public final Instant nextRunAt;
    public final SignalAction lastSignal;
    public final Instant lastRunAt;
    public final Instant inFlightUntil;
    public final Instant claimedAt;
    public final Instant createdAt;
    public final Instant updatedAt;

    public boolean leasedAt(Instant now) {
        return inFlightUntil != null && inFlightUntil.isAfter(now);
    }

    @Override
    public String toString() {
        return "Schedule{id=" + id
                + ", layoutId=" + layoutId
                + ", frequency=" + (frequency == null ? "-" : frequency.label())
                + ", enabled=" + enabled
                + ", nextRunAt=" + nextRunAt
                + "}";
    }
}
