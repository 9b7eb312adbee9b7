package com.chartbot.automation;

import com.chartbot.model.DecisionReason;
import com.chartbot.model.Frequency;
import com.chartbot.model.NotificationDecision;
import com.chartbot.model.Schedule;
import com.chartbot.model.Signal;
import com.chartbot.model.SignalAction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NotificationGateTest {
    private final NotificationGate gate = new NotificationGate();

    @Test
    void decide_shouldSuppressUnchangedBuyAndSendSell() {
        Schedule schedule = schedule().onlyOnSignalChange(true).minConfidence(50).sendOnHold(false)
                .lastSignal(SignalAction.BUY).build();

        NotificationDecision sameAction = gate.decide(signal(SignalAction.BUY, 80), schedule);
        NotificationDecision changed = gate.decide(signal(SignalAction.SELL, 80), schedule);

        assertFalse(sameAction.send());
        assertEquals(DecisionReason.UNCHANGED_SIGNAL, sameAction.reason());
        assertTrue(changed.send());
        assertEquals(DecisionReason.SEND, changed.reason());
    }

    @Test
    void decide_shouldSuppressHoldRegardlessOfConfidence() {
        Schedule schedule = schedule().sendOnHold(false).minConfidence(0).build();

        NotificationDecision decision = gate.decide(signal(SignalAction.HOLD, 95), schedule);

        assertFalse(decision.send());
        assertEquals(DecisionReason.HOLD_SUPPRESSED, decision.reason());
    }

    @Test
    void decide_shouldSendHoldWhenEnabled() {
        Schedule schedule = schedule().sendOnHold(true).build();

        assertTrue(gate.decide(signal(SignalAction.HOLD, 95), schedule).send());
    }

    @Test
    void decide_thresholdShouldBeInclusive() {
        Schedule schedule = schedule().minConfidence(70).build();

        assertTrue(gate.decide(signal(SignalAction.BUY, 70), schedule).send());
        NotificationDecision below = gate.decide(signal(SignalAction.BUY, 69), schedule);
        assertFalse(below.send());
        assertEquals(DecisionReason.BELOW_THRESHOLD, below.reason());
    }

    @Test
    void decide_channelDisabledShouldWinOverEveryOtherRule() {
        Schedule schedule = schedule().sendToTelegram(false).sendOnHold(false).minConfidence(99)
                .onlyOnSignalChange(true).lastSignal(SignalAction.HOLD).build();

        NotificationDecision decision = gate.decide(signal(SignalAction.HOLD, 10), schedule);

        assertEquals(DecisionReason.CHANNEL_DISABLED, decision.reason());
    }

    @Test
    void decide_shouldApplyRulesInOrder() {
        Schedule schedule = schedule().minConfidence(90).onlyOnSignalChange(true).lastSignal(SignalAction.BUY).build();

        assertEquals(DecisionReason.BELOW_THRESHOLD, gate.decide(signal(SignalAction.BUY, 60), schedule).reason());
        assertEquals(DecisionReason.UNCHANGED_SIGNAL, gate.decide(signal(SignalAction.BUY, 95), schedule).reason());
    }

    @Test
    void decide_shouldSendFirstSignalWhenNoPreviousOne() {
        Schedule schedule = schedule().onlyOnSignalChange(true).lastSignal(null).build();

        assertTrue(gate.decide(signal(SignalAction.BUY, 80), schedule).send());
    }

    @Test
    void decide_shouldBePure() {
        Schedule schedule = schedule().onlyOnSignalChange(true).lastSignal(SignalAction.SELL).build();
        Signal signal = signal(SignalAction.BUY, 75);

        NotificationDecision first = gate.decide(signal, schedule);
        NotificationDecision second = gate.decide(signal, schedule);

        assertEquals(first, second);
        assertEquals(SignalAction.SELL, schedule.lastSignal);
    }

    private static Schedule.ScheduleBuilder schedule() {
        return Schedule.builder()
                .id(1L)
                .userId("u")
                .layoutId("l")
                .enabled(true)
                .frequency(Frequency.ONE_HOUR)
                .sendToTelegram(true)
                .minConfidence(50);
    }

    private static Signal signal(SignalAction action, int confidence) {
        return Signal.builder()
                .id(10L)
                .action(action)
                .confidence(confidence)
                .timeframe("swing")
                .reasons(List.of("reason"))
                .build();
    }
}
