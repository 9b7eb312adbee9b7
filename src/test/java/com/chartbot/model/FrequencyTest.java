package com.chartbot.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrequencyTest {

    @Test
    void fromLabel_shouldParseEverySupportedCadence() {
        assertEquals(Frequency.FIFTEEN_MINUTES, Frequency.fromLabel("15m"));
        assertEquals(Frequency.ONE_HOUR, Frequency.fromLabel(" 1H "));
        assertEquals(Frequency.FOUR_HOURS, Frequency.fromLabel("4h"));
        assertEquals(Frequency.ONE_DAY, Frequency.fromLabel("1d"));
        assertEquals(Duration.ofDays(7), Frequency.fromLabel("1w").interval());
    }

    @Test
    void fromLabel_shouldRejectUnknownCadence() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> Frequency.fromLabel("2h"));
        assertTrue(e.getMessage().contains("allowed"));
        assertThrows(IllegalArgumentException.class, () -> Frequency.fromLabel(""));
    }

    @Test
    void smallestInterval_shouldBeFifteenMinutes() {
        assertEquals(Duration.ofMinutes(15), Frequency.smallestInterval());
    }

    @Test
    void jobStatusFromLabel_shouldFallBackToIncomplete() {
        assertEquals(JobStatus.DISPATCH_FAILED, JobStatus.fromLabel("dispatch-failed"));
        assertEquals(JobStatus.INCOMPLETE, JobStatus.fromLabel("exploded"));
        assertTrue(JobStatus.PERSISTENCE_FAILED.failed());
    }
}
