package com.chartbot.model;

public final class TriggerResult {
    public final boolean accepted;
    public final JobStatus status;
    public final String message;

    private TriggerResult(boolean accepted, JobStatus status, String message) {
        this.accepted = accepted;
        this.status = status;
        this.message = message;
    }

    public static TriggerResult completed(JobStatus status, String message) {
        return new TriggerResult(true, status, message);
    }

    public static TriggerResult busy(long scheduleId) {
        return new TriggerResult(false, null, "BUSY: schedule " + scheduleId + " already has a job in flight");
    }

    @Override
    public String toString() {
        return "TriggerResult{accepted=" + accepted
                + ", status=" + (status == null ? "-" : status.label())
                + ", message=" + message
                + "}";
    }
}
