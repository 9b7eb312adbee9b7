package com.chartbot.automation;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.core.JobTelemetry;
import com.chartbot.model.JobLog;
import com.chartbot.model.JobStatus;
import com.chartbot.model.JobTrigger;
import com.chartbot.model.Schedule;
import com.chartbot.store.JobLogRepository;
import com.chartbot.store.ScheduleRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Writes the single job log of an attempt and advances its schedule in the same transaction.
 */
public final class JobLogRecorder {
    private static final Logger LOG = LogManager.getLogger(JobLogRecorder.class);
    static final String RECOVERED_ERROR = "job abandoned by a stopped scheduler process";

    private final ScheduleRepository schedules;
    private final JobLogRepository jobLogs;
    private final Clock clock;

    public JobLogRecorder(ScheduleRepository schedules, JobLogRepository jobLogs, Clock clock) {
        this.schedules = schedules;
        this.jobLogs = jobLogs;
        this.clock = clock;
    }

    /**
     * Records the attempt's outcome unless another caller already did.
     *
     * @return the written log, or null when the attempt was already finalized or nothing could be written
     */
    public JobLog record(JobAttempt attempt, JobOutcome outcome) {
        if (!attempt.markFinalized()) {
            LOG.debug("job log already written schedule_id={} late_outcome={}", attempt.scheduleId(), outcome);
            return null;
        }
        Instant finishedAt = clock.instant();
        attempt.telemetry.finish(finishedAt, outcome.status.label());
        JobLog log = toLog(attempt, outcome, finishedAt);
        Instant nextRunAt = finishedAt.plus(attempt.schedule.frequency.interval());

        attempt.telemetry.startStep(JobTelemetry.STEP_RECORD);
        try {
            JobLog stored = schedules.complete(log, nextRunAt);
            attempt.telemetry.endStep(JobTelemetry.STEP_RECORD, true);
            LOG.info("job done {} next_run_at={}", attempt.telemetry.getSummary(), nextRunAt);
            return stored;
        } catch (PersistenceException e) {
            attempt.telemetry.endStep(JobTelemetry.STEP_RECORD, false, "completion");
            LOG.error("job completion write failed schedule_id={} status={} err={}",
                    attempt.scheduleId(), outcome.status.label(), e.getMessage());
            return appendPersistenceFailure(log, e);
        }
    }

    /**
     * Clears leases left by a previous process and appends an INCOMPLETE log for each.
     */
    public int recoverAbandoned() {
        Instant now = clock.instant();
        List<Schedule> released;
        try {
            released = schedules.releaseAllLeases(now);
        } catch (PersistenceException e) {
            LOG.error("lease recovery failed err={}", e.getMessage());
            return 0;
        }
        int written = 0;
        for (Schedule schedule : released) {
            Instant startedAt = schedule.claimedAt == null ? now : schedule.claimedAt;
            JobLog log = JobLog.builder()
                    .scheduleId(schedule.id)
                    .trigger(JobTrigger.RECOVERY)
                    .startedAt(startedAt)
                    .finishedAt(now)
                    .status(JobStatus.INCOMPLETE)
                    .telegramSent(false)
                    .error(RECOVERED_ERROR)
                    .durationMs(Math.max(0L, Duration.between(startedAt, now).toMillis()))
                    .build();
            try {
                jobLogs.append(log);
                written++;
            } catch (PersistenceException e) {
                LOG.error("recovery log write failed schedule_id={} err={}", schedule.id, e.getMessage());
            }
        }
        if (!released.isEmpty()) {
            LOG.warn("recovered abandoned jobs count={} logged={}", released.size(), written);
        }
        return written;
    }

    private JobLog appendPersistenceFailure(JobLog original, PersistenceException cause) {
        JobLog fallback = original.toBuilder()
                .status(JobStatus.PERSISTENCE_FAILED)
                .error(cause.shortDetail())
                .build();
        try {
            return jobLogs.append(fallback);
        } catch (PersistenceException e) {
            LOG.error("job log store rejected fallback row schedule_id={} err={}", original.scheduleId, e.getMessage());
            return null;
        }
    }

    private static JobLog toLog(JobAttempt attempt, JobOutcome outcome, Instant finishedAt) {
        JobLog.JobLogBuilder builder = JobLog.builder()
                .scheduleId(attempt.scheduleId())
                .trigger(attempt.trigger)
                .startedAt(attempt.startedAt)
                .finishedAt(finishedAt)
                .status(outcome.status)
                .reason(outcome.reason)
                .telegramSent(outcome.telegramSent)
                .error(outcome.error)
                .durationMs(Math.max(0L, Duration.between(attempt.startedAt, finishedAt).toMillis()));
        if (outcome.signal != null) {
            builder.signalId(outcome.signal.id).confidence(outcome.signal.confidence);
            // Dedupe state tracks the latest evaluated action only.
            if (outcome.evaluated) {
                builder.action(outcome.signal.action);
            }
        }
        return builder.build();
    }
}
