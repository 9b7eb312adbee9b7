package com.chartbot.data.capture;

import com.chartbot.automation.error.CaptureException;
import com.chartbot.config.Config;
import com.chartbot.data.http.HttpClientEx;
import com.chartbot.data.http.HttpStatusException;
import com.chartbot.model.SessionCredentials;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * chart-img.com TradingView advanced-chart client. Answers with PNG bytes.
 */
public final class ChartImgCaptureClient implements ChartCaptureClient {
    private static final Logger LOG = LogManager.getLogger(ChartImgCaptureClient.class);
    private static final String PATH = "/v2/tradingview/advanced-chart";

    private final HttpClientEx http;
    private final String endpoint;
    private final String apiKey;
    private final int width;
    private final int height;
    private final int requestTimeoutSeconds;

    public ChartImgCaptureClient(Config config, HttpClientEx http, int requestTimeoutSeconds) {
        this.http = http;
        this.endpoint = trimTrailingSlash(config.getString("capture.base-url")) + PATH;
        this.apiKey = config.getString("capture.api-key", "");
        this.width = config.getInt("capture.width", 800);
        this.height = config.getInt("capture.height", 600);
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    @Override
    public CapturedChart capture(String captureTargetId, SessionCredentials credentials) throws CaptureException {
        if (apiKey.isEmpty()) {
            throw new CaptureException("capture.api-key is not configured");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-api-key", apiKey);
        if (credentials != null && credentials.sessionId != null && credentials.sessionIdSign != null) {
            headers.put("tv-sessionid", credentials.sessionId);
            headers.put("tv-sessionid_sign", credentials.sessionIdSign);
        }
        String body = requestBody(captureTargetId);

        LOG.debug("capture request layout={} width={} height={}", captureTargetId, width, height);
        HttpClientEx.BinaryResponse response;
        try {
            response = http.postJsonForBytes(endpoint, body, headers, requestTimeoutSeconds);
        } catch (HttpStatusException e) {
            throw new CaptureException("chart-img error (" + e.statusCode() + "): " + extractError(e.body()), e);
        } catch (IOException e) {
            throw new CaptureException("chart-img request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CaptureException("chart-img request interrupted", e);
        }
        if (response.body() == null || response.body().length == 0) {
            throw new CaptureException("chart-img returned an empty response");
        }
        String mime = response.contentType().startsWith("image/") ? response.contentType() : "image/png";
        LOG.debug("capture ok layout={} bytes={}", captureTargetId, response.body().length);
        return new CapturedChart(response.body(), mime, endpoint);
    }

    String requestBody(String captureTargetId) {
        JSONObject body = new JSONObject();
        body.put("layout", captureTargetId);
        body.put("width", width);
        body.put("height", height);
        return body.toString();
    }

    static String extractError(String body) {
        if (body == null || body.isBlank()) {
            return "unknown error";
        }
        String trimmed = body.trim();
        try {
            if (trimmed.startsWith("{")) {
                JSONObject json = new JSONObject(trimmed);
                String msg = json.optString("error", json.optString("message", ""));
                if (!msg.isEmpty()) {
                    return msg;
                }
            } else if (trimmed.startsWith("[")) {
                JSONArray arr = new JSONArray(trimmed);
                if (!arr.isEmpty()) {
                    return arr.toString();
                }
            }
        } catch (JSONException ignored) {
            // not JSON; fall through to the raw body
        }
        return trimmed.length() > 200 ? trimmed.substring(0, 200) : trimmed;
    }

    private static String trimTrailingSlash(String url) {
        String out = url == null ? "" : url.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
