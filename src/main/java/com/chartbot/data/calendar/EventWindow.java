package com.chartbot.data.calendar;

import com.chartbot.model.EconomicEvent;
import com.chartbot.model.ImpactLevel;
import com.chartbot.model.RiskLevel;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits events around a reference instant into the upcoming hour and the coming week.
 */
public final class EventWindow {
    static final Duration UPCOMING_SPAN = Duration.ofHours(1);
    static final Duration WEEKLY_SPAN = Duration.ofDays(7);

    private static final Comparator<EconomicEvent> ORDER = Comparator
            .comparing((EconomicEvent e) -> e.time)
            .thenComparingInt(e -> e.impact.sortRank());

    public final List<EconomicEvent> upcoming;
    public final List<EconomicEvent> weekly;

    private EventWindow(List<EconomicEvent> upcoming, List<EconomicEvent> weekly) {
        this.upcoming = upcoming;
        this.weekly = weekly;
    }

    /**
     * Upcoming: within one hour of {@code reference} on either side. Weekly: from {@code reference} to seven days
     * after it. An event can be in both. Both lists are ordered by time, then HIGH before MEDIUM before LOW.
     */
    public static EventWindow partition(List<EconomicEvent> events, Instant reference) {
        List<EconomicEvent> upcoming = new ArrayList<>();
        List<EconomicEvent> weekly = new ArrayList<>();
        if (events != null) {
            long hourMs = UPCOMING_SPAN.toMillis();
            long weekMs = WEEKLY_SPAN.toMillis();
            for (EconomicEvent event : events) {
                if (event == null || event.time == null) {
                    continue;
                }
                long diff = event.time.toEpochMilli() - reference.toEpochMilli();
                if (Math.abs(diff) <= hourMs) {
                    upcoming.add(event);
                }
                if (diff >= 0 && diff <= weekMs) {
                    weekly.add(event);
                }
            }
        }
        upcoming.sort(ORDER);
        weekly.sort(ORDER);
        return new EventWindow(List.copyOf(upcoming), List.copyOf(weekly));
    }

    public boolean isEmpty() {
        return upcoming.isEmpty() && weekly.isEmpty();
    }

    public static RiskLevel immediateRisk(List<EconomicEvent> events) {
        if (events == null || events.isEmpty()) {
            return RiskLevel.NONE;
        }
        long high = events.stream().filter(e -> e.impact == ImpactLevel.HIGH).count();
        long medium = events.stream().filter(e -> e.impact == ImpactLevel.MEDIUM).count();
        if (high >= 2) {
            return RiskLevel.EXTREME;
        }
        if (high == 1) {
            return RiskLevel.HIGH;
        }
        if (medium >= 3) {
            return RiskLevel.HIGH;
        }
        if (medium >= 1) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }
}
