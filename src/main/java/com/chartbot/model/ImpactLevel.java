package com.chartbot.model;

import java.util.Locale;

public enum ImpactLevel {
    HIGH(0),
    MEDIUM(1),
    LOW(2);

    private final int sortRank;

    ImpactLevel(int sortRank) {
        this.sortRank = sortRank;
    }

    public int sortRank() {
        return sortRank;
    }

    public static ImpactLevel fromLabel(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("high")) {
            return HIGH;
        }
        if (value.equals("medium")) {
            return MEDIUM;
        }
        return LOW;
    }
}
