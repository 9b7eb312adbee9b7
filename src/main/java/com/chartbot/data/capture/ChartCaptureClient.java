package com.chartbot.data.capture;

import com.chartbot.automation.error.CaptureException;
import com.chartbot.model.SessionCredentials;

/**
 * Renders a saved chart layout to an image.
 */
public interface ChartCaptureClient {
    CapturedChart capture(String captureTargetId, SessionCredentials credentials) throws CaptureException;

    record CapturedChart(byte[] bytes, String mimeType, String sourceUrl) {
    }
}
