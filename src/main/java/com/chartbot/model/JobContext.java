package com.chartbot.model;

import java.time.Instant;

/**
 * Everything one job needs, resolved once when the job is built and never persisted.
 * The schedule is a snapshot; filter settings are read from it, not from the store.
 */
public final class JobContext {
    public final Schedule schedule;
    public final String layoutId;
    public final String captureTargetId;
    public final String symbol;
    public final String interval;
    public final SessionCredentials credentials;
    public final TelegramTarget target;
    public final String model;
    public final JobTrigger trigger;
    public final Instant startedAt;

    public JobContext(
            Schedule schedule,
            String layoutId,
            String captureTargetId,
            String symbol,
            String interval,
            SessionCredentials credentials,
            TelegramTarget target,
            String model,
            JobTrigger trigger,
            Instant startedAt
    ) {
        this.schedule = schedule;
        this.layoutId = layoutId;
        this.captureTargetId = captureTargetId;
        this.symbol = symbol;
        this.interval = interval;
        this.credentials = credentials;
        this.target = target;
        this.model = model;
        this.trigger = trigger;
        this.startedAt = startedAt;
    }

    public long scheduleId() {
        return schedule.id;
    }

    public String userId() {
        return schedule.userId;
    }

    public boolean hasSymbol() {
        return symbol != null && !symbol.trim().isEmpty();
    }

    public String logTag() {
        return "schedule_id=" + schedule.id + ", layout_id=" + layoutId + ", trigger=" + trigger;
    }
}
