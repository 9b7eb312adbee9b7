package com.chartbot.automation.error;

import com.chartbot.model.JobStatus;

public final class ValidationException extends AutomationException {
    public ValidationException(String message) {
        super(message);
    }

    @Override
    public JobStatus jobStatus() {
        return JobStatus.INCOMPLETE;
    }
}
