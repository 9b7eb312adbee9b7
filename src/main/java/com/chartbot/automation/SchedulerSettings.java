package com.chartbot.automation;

import lombok.Builder;

import java.time.Duration;

/**
 * Timing and sizing knobs of the loop and its stages.
 */
@Builder
public final class SchedulerSettings {
    public static final Duration MAX_TICK = Duration.ofSeconds(900);

    @Builder.Default
    public final Duration tick = Duration.ofSeconds(300);
    @Builder.Default
    public final int jobParallelism = 4;
    @Builder.Default
    public final int captureConcurrency = 2;
    @Builder.Default
    public final Duration captureTimeout = Duration.ofSeconds(45);
    @Builder.Default
    public final Duration analysisTimeout = Duration.ofSeconds(120);
    @Builder.Default
    public final Duration enrichmentTimeout = Duration.ofSeconds(30);
    @Builder.Default
    public final Duration jobTimeout = Duration.ofSeconds(300);
    @Builder.Default
    public final Duration shutdownGrace = Duration.ofSeconds(60);

    /**
     * Lease written to the schedule row while a job runs. Outlives the job timeout so only a crashed
     * process leaves a lease behind.
     */
    public Duration lease() {
        return jobTimeout.plus(shutdownGrace);
    }

    public SchedulerSettings validate() {
        if (tick.isZero() || tick.isNegative() || tick.compareTo(MAX_TICK) > 0) {
            throw new IllegalArgumentException("scheduler.tick-seconds must be in 1..900, got " + tick.toSeconds());
        }
        if (jobParallelism < 1) {
            throw new IllegalArgumentException("scheduler.job-parallelism must be >= 1");
        }
        if (captureConcurrency < 1) {
            throw new IllegalArgumentException("scheduler.capture-concurrency must be >= 1");
        }
        requirePositive(captureTimeout, "scheduler.capture-timeout-seconds");
        requirePositive(analysisTimeout, "scheduler.analysis-timeout-seconds");
        requirePositive(enrichmentTimeout, "scheduler.enrichment-timeout-seconds");
        requirePositive(jobTimeout, "scheduler.job-timeout-seconds");
        if (shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("scheduler.shutdown-grace-seconds must be >= 0");
        }
        return this;
    }

    private static void requirePositive(Duration value, String key) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(key + " must be > 0");
        }
    }
}
