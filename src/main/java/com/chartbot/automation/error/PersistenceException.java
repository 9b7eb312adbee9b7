package com.chartbot.automation.error;

import com.chartbot.model.JobStatus;

public final class PersistenceException extends AutomationException {
    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public JobStatus jobStatus() {
        return JobStatus.PERSISTENCE_FAILED;
    }
}
