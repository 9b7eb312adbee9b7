package com.chartbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EconomicContextRow {
    private Long id;
    private long signalId;
    private String symbol;
    private String immediateRisk;
    private String weeklyOutlook;
    private String impactSummary;
    private String warningsJson;
    private String opportunitiesJson;
    private String recommendation;
    private String upcomingEventsJson;
    private String weeklyEventsJson;
    private OffsetDateTime createdAt;
}
