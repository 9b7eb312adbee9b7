package com.chartbot.model;

public record NotificationDecision(boolean send, DecisionReason reason) {
    public NotificationDecision {
        reason = reason == null ? DecisionReason.SEND : reason;
        if (send && reason != DecisionReason.SEND) {
            throw new IllegalArgumentException("send decision must carry reason SEND");
        }
    }

    public static NotificationDecision sendIt() {
        return new NotificationDecision(true, DecisionReason.SEND);
    }

    public static NotificationDecision suppress(DecisionReason reason) {
        return new NotificationDecision(false, reason);
    }
}
