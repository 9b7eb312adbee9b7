package com.chartbot.automation;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.model.Schedule;
import com.chartbot.store.ScheduleRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only selection of the schedules a tick should run.
 */
public final class DueSelector {
    private static final Comparator<Schedule> ORDER = Comparator
            .comparing((Schedule s) -> s.nextRunAt)
            .thenComparingLong(s -> s.id);

    private final ScheduleRepository schedules;

    public DueSelector(ScheduleRepository schedules) {
        this.schedules = schedules;
    }

    /**
     * Enabled schedules whose nextRunAt is at or before {@code now} and that hold no unexpired lease,
     * oldest nextRunAt first.
     */
    public List<Schedule> selectDue(Instant now) throws PersistenceException {
        List<Schedule> out = new ArrayList<>();
        for (Schedule schedule : schedules.findDue(now)) {
            if (isDue(schedule, now)) {
                out.add(schedule);
            }
        }
        out.sort(ORDER);
        return out;
    }

    static boolean isDue(Schedule schedule, Instant now) {
        return schedule != null
                && schedule.enabled
                && schedule.nextRunAt != null
                && !schedule.nextRunAt.isAfter(now)
                && !schedule.leasedAt(now);
    }
}
