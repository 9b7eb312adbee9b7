package com.chartbot.automation;

import com.chartbot.model.DecisionReason;
import com.chartbot.model.NotificationDecision;
import com.chartbot.model.Schedule;
import com.chartbot.model.Signal;
import com.chartbot.model.SignalAction;

/**
 * Decides whether a signal is worth a notification. Pure: same inputs, same answer, no side effects.
 * First matching rule wins.
 */
public final class NotificationGate {

    public NotificationDecision decide(Signal signal, Schedule schedule) {
        if (!schedule.sendToTelegram) {
            return NotificationDecision.suppress(DecisionReason.CHANNEL_DISABLED);
        }
        if (signal.action == SignalAction.HOLD && !schedule.sendOnHold) {
            return NotificationDecision.suppress(DecisionReason.HOLD_SUPPRESSED);
        }
        if (signal.confidence < schedule.minConfidence) {
            return NotificationDecision.suppress(DecisionReason.BELOW_THRESHOLD);
        }
        if (schedule.onlyOnSignalChange && signal.action == schedule.lastSignal) {
            return NotificationDecision.suppress(DecisionReason.UNCHANGED_SIGNAL);
        }
        return NotificationDecision.sendIt();
    }
}
