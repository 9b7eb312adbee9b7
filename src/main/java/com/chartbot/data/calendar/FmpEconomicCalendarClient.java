package com.chartbot.data.calendar;

import com.chartbot.automation.error.EnrichmentException;
import com.chartbot.config.Config;
import com.chartbot.data.http.HttpClientEx;
import com.chartbot.model.EconomicEvent;
import com.chartbot.model.ImpactLevel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Financial Modeling Prep economic calendar client.
 * Responses are cached per (date window, countries) and upstream calls are capped per UTC day;
 * when the cap is reached or a call fails, a stale cached answer is served if one exists.
 */
public final class FmpEconomicCalendarClient implements EconomicEventFeed {
    private static final Logger LOG = LogManager.getLogger(FmpEconomicCalendarClient.class);
    private static final DateTimeFormatter FMP_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final HttpClientEx http;
    private final Clock clock;
    private final String baseUrl;
    private final String apiKey;
    private final Duration cacheTtl;
    private final int dailyRequestLimit;
    private final int requestTimeoutSeconds;

    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private LocalDate budgetDay;
    private int budgetUsed;

    public FmpEconomicCalendarClient(Config config, HttpClientEx http, Clock clock) {
        this.http = http;
        this.clock = clock;
        this.baseUrl = config.getString("economic.base-url");
        this.apiKey = config.getString("economic.api-key", "");
        this.cacheTtl = Duration.ofHours(Math.max(0, config.getInt("economic.cache-hours", 6)));
        this.dailyRequestLimit = Math.max(0, config.getInt("economic.daily-request-limit", 250));
        this.requestTimeoutSeconds = Math.max(1, config.getInt("economic.request-timeout-seconds", 20));
    }

    @Override
    public List<EconomicEvent> fetchEvents(Instant from, Instant to, Collection<String> countries) throws EnrichmentException {
        Set<String> codes = normalizeCodes(countries);
        String fromDate = LocalDate.ofInstant(from, ZoneOffset.UTC).toString();
        String toDate = LocalDate.ofInstant(to, ZoneOffset.UTC).toString();
        String key = fromDate + "_" + toDate + "_" + (codes.isEmpty() ? "all" : String.join(",", codes));

        Instant now = clock.instant();
        CacheEntry cached = cache.get(key);
        if (cached != null && cached.fetchedAt.plus(cacheTtl).isAfter(now)) {
            LOG.debug("economic calendar cache hit key={}", key);
            return filterRange(cached.events, from, to);
        }

        if (apiKey.isEmpty()) {
            throw new EnrichmentException("economic.api-key is not configured");
        }
        if (!tryConsumeBudget(now)) {
            LOG.warn("economic calendar daily request limit reached limit={} stale_cache={}", dailyRequestLimit, cached != null);
            if (cached != null) {
                return filterRange(cached.events, from, to);
            }
            throw new EnrichmentException("economic calendar request limit reached and no cached data");
        }

        String url = baseUrl + "/economic_calendar?from=" + fromDate + "&to=" + toDate
                + "&apikey=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        try {
            String body = http.getText(url, Map.of(), requestTimeoutSeconds);
            List<EconomicEvent> events = parseEvents(body, codes);
            cache.put(key, new CacheEntry(events, now));
            LOG.info("economic calendar fetched from={} to={} countries={} events={}", fromDate, toDate, codes, events.size());
            return filterRange(events, from, to);
        } catch (IOException | JSONException e) {
            if (cached != null) {
                LOG.warn("economic calendar fetch failed, serving stale cache: {}", e.getMessage());
                return filterRange(cached.events, from, to);
            }
            throw new EnrichmentException("economic calendar fetch failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnrichmentException("economic calendar fetch interrupted", e);
        }
    }

    synchronized int budgetUsed() {
        return budgetUsed;
    }

    private synchronized boolean tryConsumeBudget(Instant now) {
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        if (!today.equals(budgetDay)) {
            budgetDay = today;
            budgetUsed = 0;
        }
        if (budgetUsed >= dailyRequestLimit) {
            return false;
        }
        budgetUsed++;
        return true;
    }

    static List<EconomicEvent> parseEvents(String body, Set<String> countries) {
        JSONArray arr = new JSONArray(body == null || body.isBlank() ? "[]" : body.trim());
        List<EconomicEvent> out = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (int i = 0; i < arr.length(); i++) {
            JSONObject row = arr.optJSONObject(i);
            if (row == null) {
                continue;
            }
            String country = row.optString("country", "").trim().toUpperCase(Locale.ROOT);
            if (!countries.isEmpty() && !countries.contains(country)) {
                continue;
            }
            String rawDate = row.optString("date", "").trim();
            Instant time = parseTimestamp(rawDate);
            if (time == null) {
                continue;
            }
            String title = row.optString("event", "").trim();
            String eventId = (country + "_" + rawDate.replaceAll("[:\\s-]", "") + "_" + title.replaceAll("\\s+", "_"))
                    .toLowerCase(Locale.ROOT);
            if (!seen.add(eventId)) {
                continue;
            }
            out.add(new EconomicEvent(
                    eventId,
                    time,
                    country,
                    blankToNull(row.optString("currency", "")),
                    title,
                    ImpactLevel.fromLabel(row.optString("impact", "")),
                    categorize(title),
                    blankToNull(row.optString("actual", "")),
                    blankToNull(row.optString("estimate", "")),
                    blankToNull(row.optString("previous", "")),
                    "FMP"
            ));
        }
        return out;
    }

    static String categorize(String eventName) {
        String name = eventName == null ? "" : eventName.toLowerCase(Locale.ROOT);
        if (name.contains("gdp")) return "GDP";
        if (name.contains("employment") || name.contains("jobs") || name.contains("nfp") || name.contains("payroll")) {
            return "Employment";
        }
        if (name.contains("inflation") || name.contains("cpi") || name.contains("ppi")) return "Inflation";
        if (name.contains("interest rate") || name.contains("fed") || name.contains("ecb") || name.contains("boe")) {
            return "CentralBank";
        }
        if (name.contains("trade") || name.contains("export") || name.contains("import")) return "Trade";
        if (name.contains("retail") || name.contains("consumer")) return "Consumer";
        if (name.contains("manufacturing") || name.contains("pmi")) return "Manufacturing";
        if (name.contains("housing")) return "Housing";
        return "Other";
    }

    private static Instant parseTimestamp(String raw) {
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return LocalDateTime.parse(raw, FMP_TS).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(raw.length() >= 10 ? raw.substring(0, 10) : raw).atStartOfDay().toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }

    private static List<EconomicEvent> filterRange(List<EconomicEvent> events, Instant from, Instant to) {
        List<EconomicEvent> out = new ArrayList<>();
        for (EconomicEvent event : events) {
            if (!event.time.isBefore(from) && !event.time.isAfter(to)) {
                out.add(event);
            }
        }
        return out;
    }

    private static Set<String> normalizeCodes(Collection<String> countries) {
        Set<String> out = new TreeSet<>();
        if (countries != null) {
            for (String code : countries) {
                if (code != null && !code.isBlank()) {
                    out.add(code.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        return out;
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    private record CacheEntry(List<EconomicEvent> events, Instant fetchedAt) {
    }
}
