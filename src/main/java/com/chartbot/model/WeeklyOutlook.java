package com.chartbot.model;

import java.util.Locale;

public enum WeeklyOutlook {
    BULLISH,
    BEARISH,
    NEUTRAL,
    VOLATILE;

    public static WeeklyOutlook fromLabel(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
