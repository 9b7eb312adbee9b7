package com.chartbot.app;

import com.chartbot.model.DecisionReason;
import com.chartbot.model.Frequency;
import com.chartbot.model.JobLog;
import com.chartbot.model.JobStatus;
import com.chartbot.model.JobTrigger;
import com.chartbot.model.Schedule;
import com.chartbot.model.SignalAction;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChartBotApplicationTest {

    @Test
    void run_shouldReturnUsageErrorsWithoutStartingContext() {
        ChartBotApplication app = new ChartBotApplication();

        assertEquals(ChartBotApplication.EXIT_USAGE, app.run(new String[0]));
        assertEquals(ChartBotApplication.EXIT_USAGE, app.run(new String[]{"--bogus"}));
        assertEquals(ChartBotApplication.EXIT_USAGE, app.run(new String[]{"--logs"}));
        assertEquals(ChartBotApplication.EXIT_USAGE, app.run(new String[]{"--schedules"}));
        assertEquals(ChartBotApplication.EXIT_OK, app.run(new String[]{"--help"}));
    }

    @Test
    void buildOptions_shouldRejectTwoCommandsAtOnce() {
        assertThrows(ParseException.class,
                () -> new DefaultParser().parse(ChartBotApplication.buildOptions(), new String[]{"--run-due", "--trigger", "4"}));
    }

    @Test
    void buildOptions_shouldParseLogsFilters() throws Exception {
        CommandLine cmd = new DefaultParser().parse(ChartBotApplication.buildOptions(),
                new String[]{"--logs", "--user", "u-1", "--schedule-id", "7", "--limit", "20"});

        assertTrue(cmd.hasOption("logs"));
        assertEquals("u-1", cmd.getOptionValue("user"));
        assertEquals("7", cmd.getOptionValue("schedule-id"));
    }

    @Test
    void formatLog_shouldPrintKeyValueLine() {
        JobLog log = JobLog.builder()
                .id(5L)
                .scheduleId(7L)
                .trigger(JobTrigger.MANUAL)
                .startedAt(Instant.parse("2026-03-02T09:00:00Z"))
                .status(JobStatus.SUPPRESSED)
                .action(SignalAction.HOLD)
                .confidence(61)
                .reason(DecisionReason.HOLD_SUPPRESSED)
                .durationMs(1234L)
                .build();

        assertEquals("id=5 schedule_id=7 trigger=MANUAL started_at=2026-03-02T09:00:00Z status=suppressed"
                        + " duration_ms=1234 action=HOLD confidence=61 reason=hold-suppressed telegram_sent=false",
                ChartBotApplication.formatLog(log));
    }

    @Test
    void formatSchedule_shouldPrintDashForMissingLastSignal() {
        Schedule schedule = Schedule.builder()
                .id(3L)
                .userId("u-1")
                .layoutId("AbC123")
                .enabled(true)
                .frequency(Frequency.FOUR_HOURS)
                .minConfidence(70)
                .nextRunAt(Instant.parse("2026-03-02T12:00:00Z"))
                .build();

        assertEquals("id=3 layout_id=AbC123 enabled=true frequency=4h min_confidence=70"
                        + " next_run_at=2026-03-02T12:00:00Z last_signal=-",
                ChartBotApplication.formatSchedule(schedule));
        assertEquals("id=3 layout_id=AbC123 enabled=true frequency=4h min_confidence=70"
                        + " next_run_at=2026-03-02T12:00:00Z last_signal=SELL",
                ChartBotApplication.formatSchedule(schedule.toBuilder().lastSignal(SignalAction.SELL).build()));
    }
}
