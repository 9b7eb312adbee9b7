package com.chartbot.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-job stage timings, logged as one key=value line when the job ends.
 */
public final class JobTelemetry {
    public static final String STEP_BUILD = "BUILD";
    public static final String STEP_CAPTURE = "CAPTURE";
    public static final String STEP_ANALYSIS = "ANALYSIS";
    public static final String STEP_ENRICHMENT = "ENRICHMENT";
    public static final String STEP_GATE = "GATE";
    public static final String STEP_DISPATCH = "DISPATCH";
    public static final String STEP_RECORD = "RECORD";

    private final long scheduleId;
    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;
    private String outcome = "RUNNING";

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Long> stepStartsNanos = new HashMap<>();

    public JobTelemetry(long scheduleId, String trigger, Instant startedAt) {
        this.scheduleId = scheduleId;
        this.trigger = trigger == null || trigger.trim().isEmpty() ? "TICK" : trigger.trim();
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.put(key, System.nanoTime());
    }

    public synchronized void endStep(String name, boolean ok) {
        endStep(name, ok, "");
    }

    public synchronized void endStep(String name, boolean ok, String note) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        Long startedNanos = stepStartsNanos.remove(key);
        if (startedNanos != null) {
            stat.elapsedMs += Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        }
        stat.ok = ok;
        if (note != null && !note.trim().isEmpty()) {
            stat.note = note.trim();
        }
    }

    public synchronized void finish(Instant at, String outcome) {
        if (finishedAt == null) {
            finishedAt = at == null ? Instant.now() : at;
            this.outcome = outcome == null ? "UNKNOWN" : outcome;
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.ok, stat.note));
        }
        return out;
    }

    public synchronized String getSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("schedule_id=").append(scheduleId)
                .append(" trigger=").append(trigger)
                .append(" outcome=").append(outcome)
                .append(" total_elapsed_ms=").append(totalElapsedMs());
        for (StepStat stat : steps.values()) {
            sb.append(String.format(Locale.US, " %s=%dms", stat.name.toLowerCase(Locale.ROOT), stat.elapsedMs));
            if (!stat.ok) {
                sb.append("(failed)");
            }
            if (!stat.note.isEmpty()) {
                sb.append("[").append(stat.note).append("]");
            }
        }
        return sb.toString();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private boolean ok = true;
        private String note = "";

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(String name, long elapsedMs, boolean ok, String note) {
    }
}
