package com.chartbot.model;

import lombok.Builder;

import java.time.Instant;

/**
 * One row per job attempt. Append-only.
 */
@Builder(toBuilder = true)
public final class JobLog {
    public final Long id;
    public final long scheduleId;
    public final JobTrigger trigger;
    public final Instant startedAt;
    public final Instant finishedAt;
    public final JobStatus status;
    public final Long signalId;
    public final SignalAction action;
    public final Integer confidence;
    public final DecisionReason reason;
    public final boolean telegramSent;
    public final String error;
    public final long durationMs;
}
