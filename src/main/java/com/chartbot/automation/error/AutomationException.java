package com.chartbot.automation.error;

import com.chartbot.model.JobStatus;

/**
 * Root of the checked failures a job or a management call can raise.
 * Each subtype knows the job-log status it terminates a job with.
 */
public abstract class AutomationException extends Exception {
    private static final int MAX_DETAIL_CHARS = 500;

    protected AutomationException(String message) {
        super(message);
    }

    protected AutomationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract JobStatus jobStatus();

    /**
     * True when an upstream provider failed, as opposed to a local fault.
     */
    public boolean isGatewayError() {
        return false;
    }

    /**
     * Short, single-line detail safe to store in the job log.
     */
    public String shortDetail() {
        return shorten(getClass().getSimpleName() + ": " + getMessage());
    }

    public static String shorten(String raw) {
        if (raw == null) {
            return null;
        }
        String oneLine = raw.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= MAX_DETAIL_CHARS) {
            return oneLine;
        }
        return oneLine.substring(0, MAX_DETAIL_CHARS - 3) + "...";
    }
}
