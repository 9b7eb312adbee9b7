package com.chartbot.ai;

import com.chartbot.model.RiskLevel;
import com.chartbot.model.WeeklyOutlook;

import java.util.List;

public final class ImpactSummary {
    public final String impactSummary;
    public final RiskLevel immediateRisk;
    public final WeeklyOutlook weeklyOutlook;
    public final List<String> warnings;
    public final List<String> opportunities;
    public final String recommendation;

    public ImpactSummary(
            String impactSummary,
            RiskLevel immediateRisk,
            WeeklyOutlook weeklyOutlook,
            List<String> warnings,
            List<String> opportunities,
            String recommendation
    ) {
        this.impactSummary = impactSummary;
        this.immediateRisk = immediateRisk;
        this.weeklyOutlook = weeklyOutlook;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
        this.opportunities = opportunities == null ? List.of() : List.copyOf(opportunities);
        this.recommendation = recommendation;
    }
}
