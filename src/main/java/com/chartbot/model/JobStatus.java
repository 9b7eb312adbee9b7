package com.chartbot.model;

/**
 * Terminal outcome of one job attempt, as stored in the job log.
 */
public enum JobStatus {
    SUCCESS("success"),
    SUPPRESSED("suppressed"),
    CAPTURE_FAILED("capture-failed"),
    ANALYSIS_FAILED("analysis-failed"),
    DISPATCH_FAILED("dispatch-failed"),
    PERSISTENCE_FAILED("persistence-failed"),
    INCOMPLETE("incomplete");

    private final String label;

    JobStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean failed() {
        return this != SUCCESS && this != SUPPRESSED;
    }

    public static JobStatus fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return INCOMPLETE;
        }
        String target = raw.trim().toLowerCase();
        for (JobStatus status : values()) {
            if (status.label.equals(target)) {
                return status;
            }
        }
        return INCOMPLETE;
    }
}
