package com.chartbot.automation.error;

import com.chartbot.model.JobStatus;

/**
 * Invalid or missing configuration that stops a job before any external call.
 */
public class ConfigurationException extends AutomationException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public JobStatus jobStatus() {
        return JobStatus.CAPTURE_FAILED;
    }
}
