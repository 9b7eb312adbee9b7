package com.chartbot.automation;

import com.chartbot.automation.error.DispatchException;
import com.chartbot.model.EconomicContext;
import com.chartbot.model.ImageRef;
import com.chartbot.model.JobContext;
import com.chartbot.model.Signal;
import com.chartbot.model.TelegramTarget;
import com.chartbot.notify.TelegramAlertRenderer;
import com.chartbot.notify.TelegramTransport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;

/**
 * Delivers signal alerts, and best-effort error alerts, to the user's Telegram chat.
 */
public final class DispatchStage {
    private static final Logger LOG = LogManager.getLogger(DispatchStage.class);

    private final TelegramTransport transport;
    private final TelegramAlertRenderer renderer;
    private final boolean errorAlertsEnabled;

    public DispatchStage(TelegramTransport transport, TelegramAlertRenderer renderer, boolean errorAlertsEnabled) {
        this.transport = transport;
        this.renderer = renderer;
        this.errorAlertsEnabled = errorAlertsEnabled;
    }

    public void dispatch(JobContext context, Signal signal, EconomicContext economic, ImageRef image, TelegramTarget target)
            throws DispatchException {
        String text;
        try {
            text = renderer.renderSignalAlert(signal, economic, displayName(context), target.includeEconomic);
        } catch (RuntimeException e) {
            throw new DispatchException("alert rendering failed: " + e.getMessage(), e);
        }
        if (target.includeChart && image != null && image.size() > 0) {
            transport.sendPhoto(target.chatId, image.bytes(), image.mimeType, text);
        } else {
            transport.sendMessage(target.chatId, text);
        }
        LOG.info("dispatch ok {} signal_id={} chart={} economic={}",
                context.logTag(), signal.id, target.includeChart && image != null, economic != null && target.includeEconomic);
    }

    /**
     * Tells the user a job failed. Never throws; returns whether the alert went out.
     */
    public boolean sendErrorAlert(JobContext context, String error, Instant occurredAt) {
        if (!errorAlertsEnabled || context == null || context.target == null || !context.schedule.sendToTelegram) {
            return false;
        }
        try {
            transport.sendMessage(context.target.chatId, renderer.renderErrorAlert(displayName(context), error, occurredAt));
            return true;
        } catch (DispatchException | RuntimeException e) {
            LOG.warn("error alert failed {} err={}", context.logTag(), e.getMessage());
            return false;
        }
    }

    static String displayName(JobContext context) {
        if (context.hasSymbol()) {
            return context.interval == null ? context.symbol : context.symbol + " " + context.interval;
        }
        return context.layoutId;
    }
}
