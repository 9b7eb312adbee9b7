package com.chartbot.data.calendar;

import com.chartbot.automation.error.EnrichmentException;
import com.chartbot.config.Config;
import com.chartbot.data.http.HttpClientEx;
import com.chartbot.data.http.HttpStatusException;
import com.chartbot.model.EconomicEvent;
import com.chartbot.model.ImpactLevel;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FmpEconomicCalendarClientTest {
    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");
    private static final String BODY = "["
            + "{\"date\":\"2026-03-02 12:30:00\",\"country\":\"US\",\"event\":\"Nonfarm Payrolls\",\"currency\":\"USD\","
            + "\"impact\":\"High\",\"estimate\":\"180K\",\"previous\":\"175K\",\"actual\":\"\"},"
            + "{\"date\":\"2026-03-02 12:30:00\",\"country\":\"US\",\"event\":\"Nonfarm Payrolls\",\"currency\":\"USD\",\"impact\":\"High\"},"
            + "{\"date\":\"2026-03-03 10:00:00\",\"country\":\"EU\",\"event\":\"CPI YoY\",\"currency\":\"EUR\",\"impact\":\"Medium\"},"
            + "{\"date\":\"2026-03-03 01:00:00\",\"country\":\"JP\",\"event\":\"Tankan\",\"currency\":\"JPY\",\"impact\":\"Low\"},"
            + "{\"date\":\"garbage\",\"country\":\"US\",\"event\":\"Broken\"}"
            + "]";

    @Test
    void parseEvents_shouldFilterCountriesDedupeAndCategorize() {
        List<EconomicEvent> events = FmpEconomicCalendarClient.parseEvents(BODY, Set.of("US", "EU"));

        assertEquals(2, events.size());
        EconomicEvent nfp = events.get(0);
        assertEquals(Instant.parse("2026-03-02T12:30:00Z"), nfp.time);
        assertEquals(ImpactLevel.HIGH, nfp.impact);
        assertEquals("Employment", nfp.category);
        assertEquals("180K", nfp.forecast);
        assertNull(nfp.actual);
        assertEquals("Inflation", events.get(1).category);
    }

    @Test
    void fetchEvents_shouldServeRepeatCallsFromCache() throws Exception {
        ScriptedHttp http = new ScriptedHttp(BODY);
        FmpEconomicCalendarClient client = client(http, 250);

        List<EconomicEvent> first = client.fetchEvents(NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofDays(7)), List.of("us", "EU"));
        List<EconomicEvent> second = client.fetchEvents(NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofDays(7)), List.of("EU", "US"));

        assertEquals(2, first.size());
        assertEquals(2, second.size());
        assertEquals(1, http.urls.size());
        assertTrue(http.urls.get(0).contains("from=2026-03-02&to=2026-03-09"));
        assertEquals(1, client.budgetUsed());
    }

    @Test
    void fetchEvents_shouldStopAtDailyLimit() throws Exception {
        ScriptedHttp http = new ScriptedHttp(BODY);
        FmpEconomicCalendarClient client = client(http, 1);

        client.fetchEvents(NOW, NOW.plus(Duration.ofDays(1)), List.of("US"));
        EnrichmentException e = assertThrows(EnrichmentException.class,
                () -> client.fetchEvents(NOW, NOW.plus(Duration.ofDays(1)), List.of("JP")));

        assertTrue(e.getMessage().contains("limit"));
        assertEquals(1, http.urls.size());
    }

    @Test
    void fetchEvents_shouldFailWithoutApiKeyBeforeSpendingBudget() {
        ScriptedHttp http = new ScriptedHttp(BODY);
        FmpEconomicCalendarClient client = new FmpEconomicCalendarClient(
                Config.of(Map.of("economic.base-url", "https://fmp.test/api/v3")), http, Clock.fixed(NOW, ZoneOffset.UTC));

        assertThrows(EnrichmentException.class, () -> client.fetchEvents(NOW, NOW.plus(Duration.ofDays(1)), List.of("US")));
        assertEquals(0, client.budgetUsed());
        assertTrue(http.urls.isEmpty());
    }

    @Test
    void fetchEvents_shouldWrapHttpFailure() {
        ScriptedHttp http = new ScriptedHttp(null);
        FmpEconomicCalendarClient client = client(http, 250);

        EnrichmentException e = assertThrows(EnrichmentException.class,
                () -> client.fetchEvents(NOW, NOW.plus(Duration.ofDays(1)), List.of("US")));
        assertTrue(e.getMessage().contains("HTTP 503"));
    }

    private static FmpEconomicCalendarClient client(HttpClientEx http, int dailyLimit) {
        Config config = Config.of(Map.of(
                "economic.base-url", "https://fmp.test/api/v3",
                "economic.api-key", "secret",
                "economic.daily-request-limit", String.valueOf(dailyLimit)
        ));
        return new FmpEconomicCalendarClient(config, http, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static final class ScriptedHttp extends HttpClientEx {
        private final String body;
        final List<String> urls = new ArrayList<>();

        ScriptedHttp(String body) {
            this.body = body;
        }

        @Override
        public String getText(String url, Map<String, String> headers, int timeoutSeconds) throws IOException {
            urls.add(url);
            if (body == null) {
                throw new HttpStatusException(503, "https://fmp.test/api/v3/economic_calendar", "down");
            }
            return body;
        }
    }
}
