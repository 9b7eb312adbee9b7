package com.chartbot.automation;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.automation.error.ScheduleNotFoundException;
import com.chartbot.model.JobLog;
import com.chartbot.model.JobStatus;
import com.chartbot.model.JobTrigger;
import com.chartbot.model.Schedule;
import com.chartbot.model.TriggerResult;
import com.chartbot.store.ScheduleRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic driver. Each tick selects due schedules, claims them, runs them on a bounded pool and waits for every
 * job to be recorded before going idle again. Nothing escapes a tick.
 */
public final class SchedulerLoop implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(SchedulerLoop.class);

    private final DueSelector dueSelector;
    private final ScheduleRepository schedules;
    private final AutomationPipeline pipeline;
    private final JobLogRecorder recorder;
    private final ScheduleGuard guard;
    private final SchedulerSettings settings;
    private final Clock clock;

    private final ExecutorService workers;
    private final ExecutorService jobThreads;
    private final ScheduledExecutorService ticker;
    private final Map<Long, JobAttempt> active = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final Object tickLock = new Object();

    public SchedulerLoop(
            DueSelector dueSelector,
            ScheduleRepository schedules,
            AutomationPipeline pipeline,
            JobLogRecorder recorder,
            ScheduleGuard guard,
            SchedulerSettings settings,
            Clock clock
    ) {
        this.dueSelector = dueSelector;
        this.schedules = schedules;
        this.pipeline = pipeline;
        this.recorder = recorder;
        this.guard = guard;
        this.settings = settings.validate();
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(settings.jobParallelism, namedThreads("chartbot-worker"));
        this.jobThreads = Executors.newCachedThreadPool(namedThreads("chartbot-job"));
        this.ticker = Executors.newSingleThreadScheduledExecutor(namedThreads("chartbot-tick"));
    }

    /**
     * Recovers leases left by a previous process, then ticks every {@code settings.tick} until {@link #close()}.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        recorder.recoverAbandoned();
        long tickMs = settings.tick.toMillis();
        ticker.scheduleWithFixedDelay(this::safeTick, 0L, tickMs, TimeUnit.MILLISECONDS);
        LOG.info("scheduler started tick_seconds={} job_parallelism={} capture_concurrency={}",
                settings.tick.toSeconds(), settings.jobParallelism, settings.captureConcurrency);
    }

    /**
     * One full due pass, run on the caller's thread. Returns the recorded status per schedule id;
     * schedules skipped because they were busy are absent.
     */
    public Map<Long, JobStatus> runDueNow() {
        synchronized (tickLock) {
            return tick();
        }
    }

    /**
     * Runs one schedule synchronously through the same guard and lease as the tick.
     */
    public TriggerResult triggerNow(long scheduleId) throws ScheduleNotFoundException, PersistenceException {
        Schedule schedule = schedules.findById(scheduleId)
                .orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        if (stopping.get()) {
            return TriggerResult.completed(JobStatus.INCOMPLETE, "scheduler is shutting down");
        }
        Optional<Schedule> claimed = claim(schedule.id, clock.instant(), false);
        if (claimed.isEmpty()) {
            LOG.info("manual trigger rejected schedule_id={} reason=busy", scheduleId);
            return TriggerResult.busy(scheduleId);
        }
        JobLog log = supervise(claimed.get(), JobTrigger.MANUAL);
        if (log == null) {
            return TriggerResult.completed(JobStatus.INCOMPLETE, "job ran but its log could not be written");
        }
        return TriggerResult.completed(log.status, describe(log));
    }

    private void safeTick() {
        try {
            runDueNow();
        } catch (RuntimeException e) {
            LOG.error("tick failed", e);
        }
    }

    private Map<Long, JobStatus> tick() {
        Map<Long, JobStatus> results = new LinkedHashMap<>();
        if (stopping.get()) {
            return results;
        }
        Instant now = clock.instant();
        List<Schedule> due;
        try {
            due = dueSelector.selectDue(now);
        } catch (PersistenceException e) {
            LOG.error("due selection failed err={}", e.getMessage());
            return results;
        }
        if (due.isEmpty()) {
            LOG.debug("tick idle at={}", now);
            return results;
        }

        List<Schedule> claimed = new ArrayList<>();
        List<Future<JobLog>> futures = new ArrayList<>();
        for (Schedule candidate : due) {
            Optional<Schedule> fresh = claim(candidate.id, now, true);
            if (fresh.isEmpty()) {
                LOG.info("schedule busy or no longer due, skipped this tick schedule_id={}", candidate.id);
                continue;
            }
            Schedule schedule = fresh.get();
            claimed.add(schedule);
            futures.add(workers.submit(() -> supervise(schedule, JobTrigger.TICK)));
        }
        LOG.info("tick at={} due={} started={}", now, due.size(), claimed.size());

        for (int i = 0; i < futures.size(); i++) {
            Schedule schedule = claimed.get(i);
            try {
                JobLog log = futures.get(i).get();
                results.put(schedule.id, log == null ? JobStatus.INCOMPLETE : log.status);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("tick interrupted while waiting for jobs");
                break;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LOG.error("job supervisor failed schedule_id={}", schedule.id, cause);
                results.put(schedule.id, JobStatus.INCOMPLETE);
            }
        }
        return results;
    }

    /**
     * Takes the in-process guard, then the database lease. Both or neither. The returned copy is the row as
     * the lease left it, so a job never runs on a snapshot read before an earlier job completed.
     */
    private Optional<Schedule> claim(long scheduleId, Instant now, boolean requireDue) {
        if (!guard.tryEnter(scheduleId)) {
            return Optional.empty();
        }
        try {
            Optional<Schedule> claimed = schedules.tryClaim(scheduleId, now, now.plus(settings.lease()), requireDue);
            if (claimed.isPresent()) {
                return claimed;
            }
        } catch (PersistenceException e) {
            LOG.error("lease claim failed schedule_id={} err={}", scheduleId, e.getMessage());
        }
        guard.exit(scheduleId);
        return Optional.empty();
    }

    /**
     * Runs the pipeline on a job thread bounded by the job timeout and records the outcome once.
     * The guard is released when the job thread actually exits, so an abandoned job still blocks
     * a second capture of the same schedule.
     */
    private JobLog supervise(Schedule schedule, JobTrigger trigger) {
        JobAttempt attempt = new JobAttempt(schedule, trigger, clock.instant());
        active.put(schedule.id, attempt);
        Future<JobOutcome> future = jobThreads.submit(() -> {
            if (!attempt.tryStart()) {
                return null;
            }
            try {
                return pipeline.run(attempt);
            } finally {
                guard.exit(schedule.id);
            }
        });
        try {
            JobOutcome outcome;
            try {
                outcome = future.get(settings.jobTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                LOG.warn("job abandoned schedule_id={} reason=timeout_after_{}s", schedule.id, settings.jobTimeout.toSeconds());
                outcome = JobOutcome.incomplete("job timed out after " + settings.jobTimeout.toSeconds() + "s", null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                outcome = JobOutcome.incomplete("job abandoned: scheduler shutting down", null);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                LOG.error("job thread failed schedule_id={}", schedule.id, cause);
                outcome = JobOutcome.incomplete("job thread failed: " + cause.getMessage(), null);
            }
            if (outcome == null) {
                outcome = JobOutcome.incomplete("job never started", null);
            }
            return recorder.record(attempt, outcome);
        } finally {
            if (attempt.abandonBeforeStart()) {
                guard.exit(schedule.id);
            }
            active.remove(schedule.id, attempt);
        }
    }

    /**
     * Stops ticking, waits up to the shutdown grace for running jobs, then records INCOMPLETE for the rest.
     */
    @Override
    public void close() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        ticker.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(settings.shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                abandonActive();
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandonActive();
            workers.shutdownNow();
        }
        jobThreads.shutdownNow();
        LOG.info("scheduler stopped");
    }

    int activeJobs() {
        return active.size();
    }

    private void abandonActive() {
        for (JobAttempt attempt : new ArrayList<>(active.values())) {
            if (recorder.record(attempt, JobOutcome.incomplete("job abandoned at shutdown", null)) != null) {
                LOG.warn("job abandoned at shutdown schedule_id={}", attempt.scheduleId());
            }
        }
    }

    private static String describe(JobLog log) {
        StringBuilder sb = new StringBuilder(log.status.label());
        if (log.action != null) {
            sb.append(" action=").append(log.action).append(" confidence=").append(log.confidence);
        }
        if (log.reason != null) {
            sb.append(" reason=").append(log.reason.label());
        }
        if (log.error != null) {
            sb.append(" error=").append(log.error);
        }
        return sb.toString();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
