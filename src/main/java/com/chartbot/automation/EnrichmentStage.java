package com.chartbot.automation;

import com.chartbot.ai.ImpactSummarizer;
import com.chartbot.ai.ImpactSummary;
import com.chartbot.automation.error.AutomationException;
import com.chartbot.data.calendar.EconomicEventFeed;
import com.chartbot.data.calendar.EventWindow;
import com.chartbot.data.calendar.SymbolResolver;
import com.chartbot.model.EconomicContext;
import com.chartbot.model.EconomicEvent;
import com.chartbot.model.JobContext;
import com.chartbot.model.RiskLevel;
import com.chartbot.model.Signal;
import com.chartbot.model.WeeklyOutlook;
import com.chartbot.store.EconomicContextRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Attaches upcoming macro events to a signal. Never fails the job: every error ends as "no enrichment".
 */
public final class EnrichmentStage {
    private static final Logger LOG = LogManager.getLogger(EnrichmentStage.class);
    static final Duration LOOK_BACK = Duration.ofHours(1);
    static final Duration LOOK_AHEAD = Duration.ofDays(7);

    private final EconomicEventFeed feed;
    private final ImpactSummarizer summarizer;
    private final EconomicContextRepository contexts;
    private final Timebox timebox;
    private final Duration timeout;
    private final Clock clock;

    public EnrichmentStage(
            EconomicEventFeed feed,
            ImpactSummarizer summarizer,
            EconomicContextRepository contexts,
            Timebox timebox,
            Duration timeout,
            Clock clock
    ) {
        this.feed = feed;
        this.summarizer = summarizer;
        this.contexts = contexts;
        this.timebox = timebox;
        this.timeout = timeout;
        this.clock = clock;
    }

    public Optional<EconomicContext> enrich(JobContext context, Signal signal) throws InterruptedException {
        if (!context.hasSymbol() || signal.id == null) {
            return Optional.empty();
        }
        try {
            return timebox.call(timeout, () -> enrichNow(context, signal));
        } catch (TimeoutException e) {
            LOG.warn("enrichment skipped {} reason=timeout_after_{}s", context.logTag(), timeout.toSeconds());
        } catch (AutomationException | RuntimeException e) {
            LOG.warn("enrichment skipped {} reason={}", context.logTag(), AutomationException.shorten(e.getMessage()));
        }
        return Optional.empty();
    }

    private Optional<EconomicContext> enrichNow(JobContext context, Signal signal) throws AutomationException {
        Instant now = clock.instant();
        SymbolResolver.SymbolInfo info = SymbolResolver.resolve(context.symbol);
        List<EconomicEvent> events = feed.fetchEvents(now.minus(LOOK_BACK), now.plus(LOOK_AHEAD), info.countries());
        EventWindow window = EventWindow.partition(events, now);
        if (window.isEmpty()) {
            LOG.debug("enrichment empty {} symbol={} countries={}", context.logTag(), context.symbol, info.countries());
            return Optional.empty();
        }

        ImpactSummary summary = summarizer.summarize(context.symbol, signal, window.upcoming, window.weekly);
        EconomicContext economic = EconomicContext.builder()
                .signalId(signal.id)
                .symbol(context.symbol)
                .immediateRisk(summary.immediateRisk == null ? RiskLevel.NONE : summary.immediateRisk)
                .weeklyOutlook(summary.weeklyOutlook == null ? WeeklyOutlook.NEUTRAL : summary.weeklyOutlook)
                .impactSummary(summary.impactSummary)
                .warnings(summary.warnings)
                .opportunities(summary.opportunities)
                .recommendation(summary.recommendation)
                .upcomingEvents(window.upcoming)
                .weeklyEvents(window.weekly)
                .createdAt(now)
                .build();
        EconomicContext stored = contexts.upsert(economic);
        LOG.info("enrichment stored {} signal_id={} risk={} outlook={} upcoming={} weekly={}",
                context.logTag(), signal.id, stored.immediateRisk, stored.weeklyOutlook,
                window.upcoming.size(), window.weekly.size());
        return Optional.of(stored);
    }
}
