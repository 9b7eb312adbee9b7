package com.chartbot.automation;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process half of per-schedule exclusivity. The database lease covers other processes.
 */
public final class ScheduleGuard {
    private final Set<Long> held = ConcurrentHashMap.newKeySet();

    public boolean tryEnter(long scheduleId) {
        return held.add(scheduleId);
    }

    public void exit(long scheduleId) {
        held.remove(scheduleId);
    }

    public int size() {
        return held.size();
    }
}
