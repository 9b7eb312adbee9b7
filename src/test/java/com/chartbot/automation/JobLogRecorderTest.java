package com.chartbot.automation;

import com.chartbot.model.DecisionReason;
import com.chartbot.model.JobLog;
import com.chartbot.model.JobStatus;
import com.chartbot.model.Schedule;
import com.chartbot.model.Signal;
import com.chartbot.model.SignalAction;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobLogRecorderTest {

    @Test
    void record_shouldWriteOnlyOnceForAnAttempt() {
        try (PipelineFixture f = new PipelineFixture()) {
            Schedule s = f.addSchedule("layout-1", PipelineFixture.schedule());
            JobAttempt attempt = f.attempt(s);
            f.clock.advance(Duration.ofSeconds(12));

            JobLog first = f.recorder.record(attempt, JobOutcome.incomplete("job timed out after 5s", null));
            JobLog second = f.recorder.record(attempt, JobOutcome.sent(signal(SignalAction.BUY)));

            assertNotNull(first);
            assertNull(second);
            assertEquals(1, f.store.logs().size());
            assertEquals(12_000L, first.durationMs);
            assertEquals(JobStatus.INCOMPLETE, first.status);
        }
    }

    @Test
    void record_shouldNotTouchLastSignalWhenGateNeverRan() {
        try (PipelineFixture f = new PipelineFixture()) {
            Schedule s = f.addSchedule("layout-1", PipelineFixture.schedule().lastSignal(SignalAction.SELL));

            JobLog log = f.recorder.record(f.attempt(s), JobOutcome.incomplete("job interrupted", signal(SignalAction.BUY)));

            assertNull(log.action);
            assertEquals(Long.valueOf(9L), log.signalId);
            assertEquals(SignalAction.SELL, f.store.schedule(s.id).lastSignal);
        }
    }

    @Test
    void record_shouldUpdateLastSignalForSuppressedOutcome() {
        try (PipelineFixture f = new PipelineFixture()) {
            Schedule s = f.addSchedule("layout-1", PipelineFixture.schedule().lastSignal(SignalAction.SELL));

            JobLog log = f.recorder.record(f.attempt(s), JobOutcome.suppressed(signal(SignalAction.BUY), DecisionReason.BELOW_THRESHOLD));

            assertEquals(SignalAction.BUY, log.action);
            assertEquals(DecisionReason.BELOW_THRESHOLD, log.reason);
            assertEquals(SignalAction.BUY, f.store.schedule(s.id).lastSignal);
        }
    }

    @Test
    void record_shouldAppendPersistenceFailureWhenCompletionIsRejected() {
        try (PipelineFixture f = new PipelineFixture()) {
            Schedule s = f.addSchedule("layout-1", PipelineFixture.schedule().lastSignal(SignalAction.SELL));
            f.store.failCompletionFor.add(s.id);

            JobLog log = f.recorder.record(f.attempt(s), JobOutcome.sent(signal(SignalAction.BUY)));

            assertEquals(JobStatus.PERSISTENCE_FAILED, log.status);
            assertTrue(log.error.contains("completion rejected"));
            Schedule after = f.store.schedule(s.id);
            assertEquals(PipelineFixture.T0, after.nextRunAt);
            assertEquals(SignalAction.SELL, after.lastSignal);
        }
    }

    @Test
    void recoverAbandoned_shouldLogEachReleasedLease() {
        try (PipelineFixture f = new PipelineFixture()) {
            Schedule leased = f.addSchedule("layout-1", PipelineFixture.schedule());
            f.addSchedule("layout-2", PipelineFixture.schedule());
            f.store.tryClaim(leased.id, PipelineFixture.T0, PipelineFixture.T0.plus(Duration.ofMinutes(6)), true);
            f.clock.advance(Duration.ofSeconds(30));

            int written = f.recorder.recoverAbandoned();

            assertEquals(1, written);
            List<JobLog> logs = f.store.logs();
            assertEquals(leased.id, logs.get(0).scheduleId);
            assertEquals(JobLogRecorder.RECOVERED_ERROR, logs.get(0).error);
            assertEquals(30_000L, logs.get(0).durationMs);
            assertEquals(0, f.recorder.recoverAbandoned());
        }
    }

    private static Signal signal(SignalAction action) {
        return Signal.builder().id(9L).action(action).confidence(80).build();
    }
}
