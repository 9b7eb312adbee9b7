package com.chartbot.data.calendar;

import com.chartbot.automation.error.EnrichmentException;
import com.chartbot.model.EconomicEvent;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Source of scheduled macroeconomic events.
 */
public interface EconomicEventFeed {
    /**
     * Events between {@code from} and {@code to}, restricted to the given country codes when non-empty.
     */
    List<EconomicEvent> fetchEvents(Instant from, Instant to, Collection<String> countries) throws EnrichmentException;
}
