package com.chartbot.automation;

import com.chartbot.automation.error.AnalysisProviderException;
import com.chartbot.automation.error.CaptureException;
import com.chartbot.automation.error.ConfigurationException;
import com.chartbot.automation.error.DispatchException;
import com.chartbot.automation.error.PersistenceException;
import com.chartbot.core.JobTelemetry;
import com.chartbot.model.DecisionReason;
import com.chartbot.model.EconomicContext;
import com.chartbot.model.ImageRef;
import com.chartbot.model.JobContext;
import com.chartbot.model.NotificationDecision;
import com.chartbot.model.Signal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Locale;

/**
 * Build, capture, analyze, enrich, gate, dispatch. Every failure is turned into a {@link JobOutcome};
 * nothing is thrown to the caller.
 */
public final class AutomationPipeline {
    private static final Logger LOG = LogManager.getLogger(AutomationPipeline.class);

    private final JobBuilder jobBuilder;
    private final CaptureStage captureStage;
    private final AnalysisStage analysisStage;
    private final EnrichmentStage enrichmentStage;
    private final NotificationGate gate;
    private final DispatchStage dispatchStage;
    private final Clock clock;

    public AutomationPipeline(
            JobBuilder jobBuilder,
            CaptureStage captureStage,
            AnalysisStage analysisStage,
            EnrichmentStage enrichmentStage,
            NotificationGate gate,
            DispatchStage dispatchStage,
            Clock clock
    ) {
        this.jobBuilder = jobBuilder;
        this.captureStage = captureStage;
        this.analysisStage = analysisStage;
        this.enrichmentStage = enrichmentStage;
        this.gate = gate;
        this.dispatchStage = dispatchStage;
        this.clock = clock;
    }

    public JobOutcome run(JobAttempt attempt) {
        JobTelemetry telemetry = attempt.telemetry;
        JobContext context = null;
        Signal signal = null;
        String step = JobTelemetry.STEP_BUILD;
        try {
            telemetry.startStep(step);
            context = jobBuilder.build(attempt.schedule, attempt.trigger, attempt.startedAt);
            telemetry.endStep(step, true, context.model);

            step = JobTelemetry.STEP_CAPTURE;
            telemetry.startStep(step);
            ImageRef image = captureStage.capture(context);
            telemetry.endStep(step, true);

            step = JobTelemetry.STEP_ANALYSIS;
            telemetry.startStep(step);
            signal = analysisStage.analyze(context, image);
            telemetry.endStep(step, true, signal.action.name());

            step = JobTelemetry.STEP_ENRICHMENT;
            telemetry.startStep(step);
            EconomicContext economic = enrichmentStage.enrich(context, signal).orElse(null);
            telemetry.endStep(step, true, economic == null ? "none" : economic.immediateRisk.name());

            step = JobTelemetry.STEP_GATE;
            telemetry.startStep(step);
            NotificationDecision decision = gate.decide(signal, context.schedule);
            if (decision.send() && context.target == null) {
                decision = NotificationDecision.suppress(DecisionReason.NO_TARGET);
            }
            telemetry.endStep(step, true, decision.reason().label());
            if (!decision.send()) {
                LOG.info("notification suppressed {} reason={}", context.logTag(), decision.reason().label());
                return JobOutcome.suppressed(signal, decision.reason());
            }

            step = JobTelemetry.STEP_DISPATCH;
            telemetry.startStep(step);
            try {
                dispatchStage.dispatch(context, signal, economic, image, context.target);
                telemetry.endStep(step, true);
                return JobOutcome.sent(signal);
            } catch (DispatchException e) {
                telemetry.endStep(step, false);
                LOG.warn("dispatch failed {} err={}", context.logTag(), e.getMessage());
                return JobOutcome.dispatchFailed(signal, e.shortDetail());
            }
        } catch (ConfigurationException | CaptureException | AnalysisProviderException e) {
            telemetry.endStep(step, false);
            LOG.warn("job failed schedule_id={} step={} status={} gateway={} err={}",
                    attempt.scheduleId(), step, e.jobStatus().label(), e.isGatewayError(), e.getMessage());
            dispatchStage.sendErrorAlert(context, e.getMessage(), clock.instant());
            return JobOutcome.failed(e, signal);
        } catch (PersistenceException e) {
            telemetry.endStep(step, false);
            LOG.error("job persistence failed schedule_id={} step={} err={}", attempt.scheduleId(), step, e.getMessage());
            return JobOutcome.failed(e, signal);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            telemetry.endStep(step, false, "interrupted");
            return JobOutcome.incomplete("job interrupted during " + step.toLowerCase(Locale.ROOT), signal);
        } catch (RuntimeException e) {
            telemetry.endStep(step, false);
            LOG.error("job crashed schedule_id={} step={}", attempt.scheduleId(), step, e);
            return JobOutcome.incomplete("unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage(), signal);
        }
    }
}
