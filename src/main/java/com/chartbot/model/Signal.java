package com.chartbot.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Analysis result for one captured chart. Identity is the capture key.
 */
@Builder(toBuilder = true)
public final class Signal {
    public final Long id;
    public final String userId;
    public final String layoutId;
    public final String captureKey;
    public final String model;
    public final SignalAction action;
    public final int confidence;
    public final String timeframe;
    public final List<String> reasons;
    public final TradeSetup tradeSetup;
    public final Instant createdAt;

    public Signal withId(long newId) {
        return toBuilder().id(newId).build();
    }

    public String firstReason() {
        if (reasons == null || reasons.isEmpty()) {
            return "";
        }
        return reasons.get(0);
    }
}
