package com.chartbot.notify;

import com.chartbot.model.EconomicContext;
import com.chartbot.model.RiskLevel;
import com.chartbot.model.Signal;
import com.chartbot.model.SignalAction;
import com.chartbot.model.TradeSetup;
import com.chartbot.model.WeeklyOutlook;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders Telegram alert text from Thymeleaf TEXT templates on the classpath.
 */
public final class TelegramAlertRenderer {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);
    static final int MAX_REASON_CHARS = 150;

    private final TemplateEngine templateEngine;
    private final String appUrl;

    public TelegramAlertRenderer(String appUrl) {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".txt");
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(true);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
        this.appUrl = trimTrailingSlash(appUrl == null || appUrl.isBlank() ? "http://localhost:3000" : appUrl);
    }

    public String renderSignalAlert(Signal signal, EconomicContext economic, String layoutName, boolean includeEconomic) {
        Context context = new Context(Locale.ROOT);
        context.setVariable("layoutName", escapeMarkdown(layoutName == null || layoutName.isBlank() ? "Chart" : layoutName));
        context.setVariable("createdAt", TS.format(signal.createdAt == null ? Instant.now() : signal.createdAt));
        context.setVariable("actionLabel", actionLabel(signal.action));
        context.setVariable("confidence", signal.confidence);
        context.setVariable("confidenceGauge", confidenceGauge(signal.confidence));

        TradeSetup setup = signal.tradeSetup;
        boolean hasSetup = setup != null && signal.action != SignalAction.HOLD && setup.hasLevels();
        context.setVariable("hasSetup", hasSetup);
        if (hasSetup) {
            context.setVariable("setupQuality", setup.quality == null ? "-" : setup.quality);
            context.setVariable("setupEntry", formatPrice(setup.entryPrice));
            context.setVariable("setupStop", formatPrice(setup.stopLoss));
            context.setVariable("setupTarget", formatPrice(setup.targetPrice));
            context.setVariable("setupRiskReward", riskReward(setup));
        }

        String reason = signal.firstReason();
        context.setVariable("firstReason", reason.isEmpty() ? null : escapeMarkdown(truncate(reason, MAX_REASON_CHARS)));

        RiskLevel risk = null;
        WeeklyOutlook outlook = null;
        boolean economicShown = includeEconomic && economic != null;
        if (economicShown) {
            risk = economic.immediateRisk == RiskLevel.NONE ? null : economic.immediateRisk;
            outlook = economic.weeklyOutlook == WeeklyOutlook.NEUTRAL ? null : economic.weeklyOutlook;
        }
        context.setVariable("economicRisk", risk == null ? null : risk.name());
        context.setVariable("weeklyOutlook", outlook == null ? null : outlook.name());
        context.setVariable("economicShown", economicShown);
        context.setVariable("analysisUrl", appUrl + "/analysis/" + (signal.id == null ? "" : signal.id));
        return templateEngine.process("telegram/signal_alert", context).trim();
    }

    public String renderErrorAlert(String layoutName, String error, Instant occurredAt) {
        Context context = new Context(Locale.ROOT);
        context.setVariable("layoutName", escapeMarkdown(layoutName == null || layoutName.isBlank() ? "Chart" : layoutName));
        context.setVariable("error", escapeMarkdown(truncate(error == null ? "unknown error" : error, 300)));
        context.setVariable("occurredAt", TS.format(occurredAt == null ? Instant.now() : occurredAt));
        return templateEngine.process("telegram/error_alert", context).trim();
    }

    static String actionLabel(SignalAction action) {
        if (action == null) {
            return "-";
        }
        switch (action) {
            case BUY:
                return "📈 BUY";
            case SELL:
                return "📉 SELL";
            case HOLD:
                return "⏸️ HOLD";
            default:
                return action.name();
        }
    }

    static String confidenceGauge(int confidence) {
        if (confidence >= 90) return "🟢🟢🟢";
        if (confidence >= 70) return "🟢🟢⚪";
        if (confidence >= 50) return "🟢⚪⚪";
        if (confidence >= 30) return "🟡⚪⚪";
        return "🔴⚪⚪";
    }

    /**
     * Forex-range prices get 5 decimals, stock-range 3, anything from 1000 up 2.
     */
    static String formatPrice(double price) {
        if (price < 10) return String.format(Locale.US, "%.5f", price);
        if (price < 1000) return String.format(Locale.US, "%.3f", price);
        return String.format(Locale.US, "%.2f", price);
    }

    static String riskReward(TradeSetup setup) {
        double risk = setup.entryPrice - setup.stopLoss;
        if (risk == 0.0) {
            return setup.riskRewardRatio == null ? "-" : String.format(Locale.US, "%.2f", setup.riskRewardRatio);
        }
        double ratio = Math.abs((setup.targetPrice - setup.entryPrice) / risk);
        return String.format(Locale.US, "%.2f", ratio);
    }

    static String escapeMarkdown(String text) {
        if (text == null) {
            return null;
        }
        return text.replace("_", "\\_").replace("*", "\\*").replace("`", "\\`").replace("[", "\\[");
    }

    private static String truncate(String text, int max) {
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }

    private static String trimTrailingSlash(String url) {
        String out = url.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
