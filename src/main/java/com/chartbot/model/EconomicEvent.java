package com.chartbot.model;

import java.time.Instant;

public final class EconomicEvent {
    public final String eventId;
    public final Instant time;
    public final String country;
    public final String currency;
    public final String title;
    public final ImpactLevel impact;
    public final String category;
    public final String actual;
    public final String forecast;
    public final String previous;
    public final String source;

    public EconomicEvent(
            String eventId,
            Instant time,
            String country,
            String currency,
            String title,
            ImpactLevel impact,
            String category,
            String actual,
            String forecast,
            String previous,
            String source
    ) {
        this.eventId = eventId;
        this.time = time;
        this.country = country;
        this.currency = currency;
        this.title = title;
        this.impact = impact == null ? ImpactLevel.LOW : impact;
        this.category = category;
        this.actual = actual;
        this.forecast = forecast;
        this.previous = previous;
        this.source = source;
    }
}
