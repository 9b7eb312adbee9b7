package com.chartbot.automation.error;

import com.chartbot.model.JobStatus;

public final class DispatchException extends AutomationException {
    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public JobStatus jobStatus() {
        return JobStatus.DISPATCH_FAILED;
    }
}
