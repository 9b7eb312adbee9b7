package com.chartbot.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobTelemetryTest {

    @Test
    void summaryShouldContainScheduleOutcomeAndSteps() {
        Instant start = Instant.parse("2026-03-02T09:00:00Z");
        JobTelemetry telemetry = new JobTelemetry(42L, "MANUAL", start);
        telemetry.startStep(JobTelemetry.STEP_CAPTURE);
        telemetry.endStep(JobTelemetry.STEP_CAPTURE, true);
        telemetry.startStep(JobTelemetry.STEP_ANALYSIS);
        telemetry.endStep(JobTelemetry.STEP_ANALYSIS, false, "timeout");
        telemetry.finish(start.plusMillis(1500), "analysis-failed");

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("schedule_id=42"));
        assertTrue(summary.contains("trigger=MANUAL"));
        assertTrue(summary.contains("outcome=analysis-failed"));
        assertTrue(summary.contains("total_elapsed_ms=1500"));
        assertTrue(summary.contains("capture="));
        assertTrue(summary.contains("(failed)[timeout]"));
    }

    @Test
    void finish_shouldKeepFirstOutcome() {
        Instant start = Instant.parse("2026-03-02T09:00:00Z");
        JobTelemetry telemetry = new JobTelemetry(1L, null, start);
        telemetry.finish(start.plusSeconds(2), "incomplete");
        telemetry.finish(start.plusSeconds(9), "success");

        assertEquals(2000L, telemetry.totalElapsedMs());
        assertTrue(telemetry.getSummary().contains("outcome=incomplete"));
        assertTrue(telemetry.getSummary().contains("trigger=TICK"));
    }

    @Test
    void stepRecords_shouldPreserveOrderAndFailureFlags() {
        JobTelemetry telemetry = new JobTelemetry(1L, "TICK", Instant.now());
        telemetry.startStep("build");
        telemetry.endStep("build", true);
        telemetry.endStep(JobTelemetry.STEP_DISPATCH, false);

        assertEquals(2, telemetry.stepRecords().size());
        assertEquals(JobTelemetry.STEP_BUILD, telemetry.stepRecords().get(0).name());
        assertFalse(telemetry.stepRecords().get(1).ok());
    }
}
