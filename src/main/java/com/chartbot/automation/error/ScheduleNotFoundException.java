package com.chartbot.automation.error;

import com.chartbot.model.JobStatus;

public final class ScheduleNotFoundException extends AutomationException {
    private final long scheduleId;

    public ScheduleNotFoundException(long scheduleId) {
        super("schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public long scheduleId() {
        return scheduleId;
    }

    @Override
    public JobStatus jobStatus() {
        return JobStatus.INCOMPLETE;
    }
}
