package com.chartbot.notify;

import com.chartbot.automation.error.DispatchException;
import com.chartbot.data.http.HttpClientEx;
import com.chartbot.data.http.HttpStatusException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Telegram Bot API over HTTP: {@code sendMessage} as JSON, {@code sendPhoto} as multipart upload.
 */
public final class TelegramBotClient implements TelegramTransport {
    private static final Logger LOG = LogManager.getLogger(TelegramBotClient.class);
    static final int MAX_CAPTION_CHARS = 1024;

    private final HttpClientEx http;
    private final String apiBaseUrl;
    private final String botToken;
    private final int timeoutSeconds;

    public TelegramBotClient(HttpClientEx http, String apiBaseUrl, String botToken, int timeoutSeconds) {
        this.http = http;
        this.apiBaseUrl = apiBaseUrl == null || apiBaseUrl.isBlank() ? "https://api.telegram.org" : apiBaseUrl.trim();
        this.botToken = botToken == null ? "" : botToken.trim();
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    @Override
    public void sendMessage(String chatId, String text) throws DispatchException {
        JSONObject body = new JSONObject();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("parse_mode", "Markdown");
        body.put("disable_web_page_preview", true);
        try {
            checkOk(http.postJson(methodUrl("sendMessage"), body.toString(), Map.of(), timeoutSeconds));
        } catch (HttpStatusException e) {
            throw new DispatchException("telegram sendMessage failed (" + e.statusCode() + "): " + describe(e.body()), e);
        } catch (IOException e) {
            throw new DispatchException("telegram sendMessage failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("telegram sendMessage interrupted", e);
        }
        LOG.info("telegram message sent chat_id={}", chatId);
    }

    @Override
    public void sendPhoto(String chatId, byte[] image, String mimeType, String caption) throws DispatchException {
        boolean captionFits = caption == null || caption.length() <= MAX_CAPTION_CHARS;
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("chat_id", chatId);
        if (captionFits && caption != null) {
            fields.put("caption", caption);
            fields.put("parse_mode", "Markdown");
        }
        try {
            checkOk(http.postMultipart(methodUrl("sendPhoto"), fields, "photo", "chart.png",
                    mimeType == null ? "image/png" : mimeType, image, timeoutSeconds));
        } catch (HttpStatusException e) {
            throw new DispatchException("telegram sendPhoto failed (" + e.statusCode() + "): " + describe(e.body()), e);
        } catch (IOException e) {
            throw new DispatchException("telegram sendPhoto failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("telegram sendPhoto interrupted", e);
        }
        LOG.info("telegram photo sent chat_id={} bytes={}", chatId, image == null ? 0 : image.length);
        if (!captionFits) {
            sendMessage(chatId, caption);
        }
    }

    private String methodUrl(String method) throws DispatchException {
        if (botToken.isEmpty()) {
            throw new DispatchException("telegram.bot-token is not configured");
        }
        return apiBaseUrl + "/bot" + botToken + "/" + method;
    }

    private void checkOk(String responseBody) throws DispatchException {
        try {
            JSONObject json = new JSONObject(responseBody == null ? "{}" : responseBody);
            if (!json.optBoolean("ok", false)) {
                throw new DispatchException("telegram rejected request: " + json.optString("description", "unknown"));
            }
        } catch (JSONException e) {
            throw new DispatchException("telegram returned unparsable response", e);
        }
    }

    private static String describe(String body) {
        try {
            return new JSONObject(body).optString("description", body);
        } catch (JSONException e) {
            return body;
        }
    }
}
