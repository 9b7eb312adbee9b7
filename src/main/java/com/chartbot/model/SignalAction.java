package com.chartbot.model;

import java.util.Locale;

public enum SignalAction {
    BUY,
    SELL,
    HOLD;

    /**
     * Lenient parse used for persisted values; returns null for blank or unknown input.
     */
    public static SignalAction fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String target = raw.trim().toUpperCase(Locale.ROOT);
        for (SignalAction action : values()) {
            if (action.name().equals(target)) {
                return action;
            }
        }
        return null;
    }
}
