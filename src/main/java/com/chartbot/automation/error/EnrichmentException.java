package com.chartbot.automation.error;

import com.chartbot.model.JobStatus;

/**
 * Economic enrichment failure. Never terminates a job; the pipeline logs it and continues.
 */
public final class EnrichmentException extends AutomationException {
    public EnrichmentException(String message) {
        super(message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public JobStatus jobStatus() {
        return JobStatus.SUCCESS;
    }
}
