package com.chartbot.data.http;

import java.io.IOException;

public final class HttpStatusException extends IOException {
    private final int statusCode;
    private final String body;

    public HttpStatusException(int statusCode, String url, String body) {
        super("HTTP " + statusCode + " for " + url + bodySnippet(body));
        this.statusCode = statusCode;
        this.body = body == null ? "" : body;
    }

    public int statusCode() {
        return statusCode;
    }

    public String body() {
        return body;
    }

    private static String bodySnippet(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String oneLine = body.replaceAll("\\s+", " ").trim();
        return " body=" + (oneLine.length() > 200 ? oneLine.substring(0, 200) + "..." : oneLine);
    }
}
