package com.chartbot.automation;

import com.chartbot.ai.ChartAnalyzer;
import com.chartbot.automation.error.AnalysisProviderException;
import com.chartbot.automation.error.AutomationException;
import com.chartbot.automation.error.PersistenceException;
import com.chartbot.model.ImageRef;
import com.chartbot.model.JobContext;
import com.chartbot.model.Signal;
import com.chartbot.store.SignalRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Runs the selected model over the captured chart and persists the result keyed by capture key.
 */
public final class AnalysisStage {
    private static final Logger LOG = LogManager.getLogger(AnalysisStage.class);

    private final ChartAnalyzer analyzer;
    private final SignalRepository signals;
    private final Timebox timebox;
    private final Duration timeout;
    private final Clock clock;

    public AnalysisStage(ChartAnalyzer analyzer, SignalRepository signals, Timebox timebox, Duration timeout, Clock clock) {
        this.analyzer = analyzer;
        this.signals = signals;
        this.timebox = timebox;
        this.timeout = timeout;
        this.clock = clock;
    }

    public Signal analyze(JobContext context, ImageRef image)
            throws AnalysisProviderException, PersistenceException, InterruptedException {
        Signal raw;
        try {
            raw = timebox.call(timeout, () -> analyzer.analyze(image, context.model));
        } catch (TimeoutException e) {
            throw new AnalysisProviderException("analysis timed out after " + timeout.toSeconds() + "s");
        } catch (AnalysisProviderException e) {
            throw e;
        } catch (AutomationException | RuntimeException e) {
            throw new AnalysisProviderException("analysis failed: " + e.getMessage(), e);
        }
        if (raw == null || raw.action == null) {
            throw new AnalysisProviderException("analysis returned no signal");
        }

        Signal toStore = raw.toBuilder()
                .userId(context.userId())
                .layoutId(context.layoutId)
                .captureKey(image.captureKey)
                .model(raw.model == null ? context.model : raw.model)
                .createdAt(clock.instant())
                .build();
        Signal stored = signals.upsert(toStore);
        LOG.info("signal stored {} signal_id={} action={} confidence={}",
                context.logTag(), stored.id, stored.action, stored.confidence);
        return stored;
    }
}
