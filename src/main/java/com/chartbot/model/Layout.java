package com.chartbot.model;

public final class Layout {
    public final String id;
    public final String userId;
    public final String captureTargetId;
    public final String symbol;
    public final String interval;

    public Layout(String id, String userId, String captureTargetId, String symbol, String interval) {
        this.id = id;
        this.userId = userId;
        this.captureTargetId = captureTargetId;
        this.symbol = symbol;
        this.interval = interval;
    }
}
