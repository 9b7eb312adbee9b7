package com.chartbot.automation.error;

/**
 * The layout or account lacks what a capture needs. Raised by the job builder before any network call.
 */
public final class MissingCredentialsException extends ConfigurationException {
    public MissingCredentialsException(String message) {
        super(message);
    }
}
