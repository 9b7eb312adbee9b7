package com.chartbot.model;

import java.time.Instant;

public final class ImageRef {
    public final String captureKey;
    public final String mimeType;
    public final Instant capturedAt;
    public final String sourceUrl;
    private final byte[] bytes;

    public ImageRef(String captureKey, String mimeType, byte[] bytes, Instant capturedAt, String sourceUrl) {
        this.captureKey = captureKey;
        this.mimeType = mimeType == null ? "image/png" : mimeType;
        this.bytes = bytes == null ? new byte[0] : bytes.clone();
        this.capturedAt = capturedAt;
        this.sourceUrl = sourceUrl;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }
}
