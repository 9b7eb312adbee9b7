package com.chartbot.model;

import java.util.Locale;

public enum RiskLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    EXTREME;

    public static RiskLevel fromLabel(String raw) {
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
