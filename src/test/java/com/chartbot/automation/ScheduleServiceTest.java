package com.chartbot.automation;

import com.chartbot.automation.error.ScheduleNotFoundException;
import com.chartbot.automation.error.ValidationException;
import com.chartbot.model.Frequency;
import com.chartbot.model.JobLog;
import com.chartbot.model.JobStatus;
import com.chartbot.model.JobTrigger;
import com.chartbot.model.Layout;
import com.chartbot.model.Schedule;
import com.chartbot.model.SignalAction;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleServiceTest {

    @Test
    void upsert_shouldCreateScheduleWithDefaults() throws Exception {
        try (PipelineFixture f = new PipelineFixture(); SchedulerLoop loop = f.loop()) {
            f.store.putLayout(new Layout("layout-1", "u1", "tv-1", "FX:EURUSD", "1h"));
            ScheduleService service = service(f, loop);

            Schedule created = service.upsert("u1", ScheduleRequest.builder().layoutId("layout-1").build());

            assertTrue(created.id > 0);
            assertTrue(created.enabled);
            assertEquals(Frequency.ONE_HOUR, created.frequency);
            assertTrue(created.sendToTelegram);
            assertFalse(created.onlyOnSignalChange);
            assertEquals(50, created.minConfidence);
            assertFalse(created.sendOnHold);
            assertEquals(PipelineFixture.T0, created.nextRunAt);
        }
    }

    @Test
    void upsert_shouldUpdateInPlaceKeepingOmittedFields() throws Exception {
        try (PipelineFixture f = new PipelineFixture(); SchedulerLoop loop = f.loop()) {
            Schedule existing = f.addSchedule("layout-1", PipelineFixture.schedule()
                    .frequency(Frequency.FOUR_HOURS)
                    .minConfidence(70)
                    .lastSignal(SignalAction.BUY)
                    .nextRunAt(PipelineFixture.T0.plus(Duration.ofHours(3))));
            f.clock.advance(Duration.ofMinutes(10));
            ScheduleService service = service(f, loop);

            Schedule updated = service.upsert(PipelineFixture.USER, ScheduleRequest.builder()
                    .layoutId("layout-1")
                    .sendOnHold(true)
                    .build());

            assertEquals(existing.id, updated.id);
            assertEquals(Frequency.FOUR_HOURS, updated.frequency);
            assertEquals(70, updated.minConfidence);
            assertTrue(updated.sendOnHold);
            assertEquals(SignalAction.BUY, updated.lastSignal);
            assertEquals(f.clock.instant(), updated.nextRunAt);
            assertEquals(1, f.store.findByUser(PipelineFixture.USER).size());
        }
    }

    @Test
    void upsert_shouldRejectInvalidInput() {
        try (PipelineFixture f = new PipelineFixture(); SchedulerLoop loop = f.loop()) {
            f.store.putLayout(new Layout("layout-1", "u1", "tv-1", "FX:EURUSD", "1h"));
            f.store.putLayout(new Layout("layout-2", "someone-else", "tv-2", "FX:EURUSD", "1h"));
            ScheduleService service = service(f, loop);

            assertThrows(ValidationException.class,
                    () -> service.upsert(" ", ScheduleRequest.builder().layoutId("layout-1").build()));
            assertThrows(ValidationException.class,
                    () -> service.upsert("u1", ScheduleRequest.builder().build()));
            assertThrows(ValidationException.class,
                    () -> service.upsert("u1", ScheduleRequest.builder().layoutId("layout-2").build()));
            assertThrows(ValidationException.class,
                    () -> service.upsert("u1", ScheduleRequest.builder().layoutId("layout-1").frequency("2h").build()));
            assertThrows(ValidationException.class,
                    () -> service.upsert("u1", ScheduleRequest.builder().layoutId("layout-1").minConfidence(101).build()));
            assertThrows(ValidationException.class,
                    () -> service.upsert("u1", ScheduleRequest.builder().layoutId("layout-1").minConfidence(-1).build()));
            assertTrue(f.store.findByUser("u1").isEmpty());
        }
    }

    @Test
    void upsert_shouldAcceptConfidenceBounds() throws Exception {
        try (PipelineFixture f = new PipelineFixture(); SchedulerLoop loop = f.loop()) {
            f.store.putLayout(new Layout("layout-1", "u1", "tv-1", "FX:EURUSD", "1h"));
            ScheduleService service = service(f, loop);

            assertEquals(0, service.upsert("u1", ScheduleRequest.builder().layoutId("layout-1").minConfidence(0).build()).minConfidence);
            assertEquals(100, service.upsert("u1", ScheduleRequest.builder().layoutId("layout-1").minConfidence(100).build()).minConfidence);
        }
    }

    @Test
    void listLogs_shouldReturnNewestFirstForOwnedSchedulesOnly() throws Exception {
        try (PipelineFixture f = new PipelineFixture(); SchedulerLoop loop = f.loop()) {
            Schedule mine = f.addSchedule("layout-1", PipelineFixture.schedule());
            f.store.putLayout(new Layout("layout-x", "other", "tv-x", "FX:EURUSD", "1h"));
            Schedule theirs = f.store.put(PipelineFixture.schedule().userId("other").layoutId("layout-x").build());
            f.store.append(log(mine.id, PipelineFixture.T0));
            f.store.append(log(mine.id, PipelineFixture.T0.plusSeconds(60)));
            f.store.append(log(theirs.id, PipelineFixture.T0.plusSeconds(120)));
            ScheduleService service = service(f, loop);

            List<JobLog> logs = service.listLogs(PipelineFixture.USER, null, 0);

            assertEquals(2, logs.size());
            assertEquals(PipelineFixture.T0.plusSeconds(60), logs.get(0).startedAt);
            assertEquals(1, service.listLogs(PipelineFixture.USER, mine.id, 1).size());
            assertTrue(service.listLogs(PipelineFixture.USER, theirs.id, 10).isEmpty());
        }
    }

    @Test
    void listSchedules_shouldReturnOnlyTheUsersSchedules() throws Exception {
        try (PipelineFixture f = new PipelineFixture(); SchedulerLoop loop = f.loop()) {
            Schedule mine = f.addSchedule("layout-1", PipelineFixture.schedule());
            f.store.putLayout(new Layout("layout-x", "other", "tv-x", "FX:EURUSD", "1h"));
            f.store.put(PipelineFixture.schedule().userId("other").layoutId("layout-x").build());
            ScheduleService service = service(f, loop);

            List<Schedule> listed = service.listSchedules(PipelineFixture.USER);

            assertEquals(1, listed.size());
            assertEquals(mine.id, listed.get(0).id);
            assertThrows(ValidationException.class, () -> service.listSchedules(" "));
        }
    }

    @Test
    void triggerNow_shouldRejectUnknownSchedule() {
        try (PipelineFixture f = new PipelineFixture(); SchedulerLoop loop = f.loop()) {
            ScheduleService service = service(f, loop);

            ScheduleNotFoundException e = assertThrows(ScheduleNotFoundException.class, () -> service.triggerNow(404L));
            assertEquals(404L, e.scheduleId());
        }
    }

    @Test
    void clampLimit_shouldApplyDefaultAndCeiling() {
        assertEquals(ScheduleService.DEFAULT_LOG_LIMIT, ScheduleService.clampLimit(0));
        assertEquals(ScheduleService.DEFAULT_LOG_LIMIT, ScheduleService.clampLimit(-5));
        assertEquals(7, ScheduleService.clampLimit(7));
        assertEquals(ScheduleService.MAX_LOG_LIMIT, ScheduleService.clampLimit(10_000));
    }

    private static ScheduleService service(PipelineFixture f, SchedulerLoop loop) {
        return new ScheduleService(f.store, f.store, f.store, loop, f.clock);
    }

    private static JobLog log(long scheduleId, Instant startedAt) {
        return JobLog.builder()
                .scheduleId(scheduleId)
                .trigger(JobTrigger.TICK)
                .startedAt(startedAt)
                .finishedAt(startedAt.plusSeconds(5))
                .status(JobStatus.SUCCESS)
                .durationMs(5_000L)
                .build();
    }
}
