package com.chartbot.automation;

import com.chartbot.core.JobTelemetry;
import com.chartbot.model.JobTrigger;
import com.chartbot.model.Schedule;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One run of one schedule. Shared between the worker running the pipeline and the supervisor that may
 * abandon it, so both sides agree on who writes the job log and who releases the guard.
 */
public final class JobAttempt {
    private static final int NEW = 0;
    private static final int RUNNING = 1;
    private static final int ABANDONED = 2;

    public final Schedule schedule;
    public final JobTrigger trigger;
    public final Instant startedAt;
    public final JobTelemetry telemetry;

    private final AtomicBoolean finalized = new AtomicBoolean(false);
    private final AtomicInteger state = new AtomicInteger(NEW);

    public JobAttempt(Schedule schedule, JobTrigger trigger, Instant startedAt) {
        this.schedule = schedule;
        this.trigger = trigger;
        this.startedAt = startedAt;
        this.telemetry = new JobTelemetry(schedule.id, trigger.name(), startedAt);
    }

    public long scheduleId() {
        return schedule.id;
    }

    /**
     * True exactly once; the caller that wins writes the job log.
     */
    boolean markFinalized() {
        return finalized.compareAndSet(false, true);
    }

    boolean tryStart() {
        return state.compareAndSet(NEW, RUNNING);
    }

    /**
     * Succeeds only if the worker never began; the caller then owns guard release.
     */
    boolean abandonBeforeStart() {
        return state.compareAndSet(NEW, ABANDONED);
    }
}
