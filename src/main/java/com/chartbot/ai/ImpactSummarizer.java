package com.chartbot.ai;

import com.chartbot.automation.error.EnrichmentException;
import com.chartbot.model.EconomicEvent;
import com.chartbot.model.Signal;

import java.util.List;

/**
 * Judges how scheduled economic events bear on a signal.
 */
public interface ImpactSummarizer {
    ImpactSummary summarize(String symbol, Signal signal, List<EconomicEvent> upcoming, List<EconomicEvent> weekly)
            throws EnrichmentException;
}
