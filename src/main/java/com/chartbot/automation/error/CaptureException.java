package com.chartbot.automation.error;

import com.chartbot.model.JobStatus;

public final class CaptureException extends AutomationException {
    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public JobStatus jobStatus() {
        return JobStatus.CAPTURE_FAILED;
    }
}
