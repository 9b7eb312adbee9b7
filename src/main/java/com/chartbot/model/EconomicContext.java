package com.chartbot.model;

import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Macro context attached to a signal. At most one per signal.
 */
@Builder(toBuilder = true)
public final class EconomicContext {
    public final Long id;
    public final long signalId;
    public final String symbol;
    public final RiskLevel immediateRisk;
    public final WeeklyOutlook weeklyOutlook;
    public final String impactSummary;
    public final List<String> warnings;
    public final List<String> opportunities;
    public final String recommendation;
    public final List<EconomicEvent> upcomingEvents;
    public final List<EconomicEvent> weeklyEvents;
    public final Instant createdAt;
}
