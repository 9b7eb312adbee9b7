package com.chartbot.model;

public enum DecisionReason {
    SEND("send"),
    CHANNEL_DISABLED("channel-disabled"),
    HOLD_SUPPRESSED("hold-suppressed"),
    BELOW_THRESHOLD("below-threshold"),
    UNCHANGED_SIGNAL("unchanged-signal"),
    NO_TARGET("no-target");

    private final String label;

    DecisionReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static DecisionReason fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String target = raw.trim().toLowerCase();
        for (DecisionReason reason : values()) {
            if (reason.label.equals(target)) {
                return reason;
            }
        }
        return null;
    }
}
