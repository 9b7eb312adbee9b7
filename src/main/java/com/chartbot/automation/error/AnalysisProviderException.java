package com.chartbot.automation.error;

import com.chartbot.model.JobStatus;

/**
 * Upstream model failure, unparsable reply or a reply that fails validation.
 */
public final class AnalysisProviderException extends AutomationException {
    public AnalysisProviderException(String message) {
        super(message);
    }

    public AnalysisProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isGatewayError() {
        return true;
    }

    @Override
    public JobStatus jobStatus() {
        return JobStatus.ANALYSIS_FAILED;
    }
}
