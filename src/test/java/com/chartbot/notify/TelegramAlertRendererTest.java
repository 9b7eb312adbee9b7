package com.chartbot.notify;

import com.chartbot.model.EconomicContext;
import com.chartbot.model.RiskLevel;
import com.chartbot.model.Signal;
import com.chartbot.model.SignalAction;
import com.chartbot.model.TradeSetup;
import com.chartbot.model.WeeklyOutlook;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelegramAlertRendererTest {
    private static final Instant AT = Instant.parse("2026-03-02T09:05:00Z");
    private final TelegramAlertRenderer renderer = new TelegramAlertRenderer("https://app.example.com/");

    @Test
    void renderSignalAlert_shouldContainSetupReasonAndLink() {
        Signal signal = Signal.builder()
                .id(31L)
                .action(SignalAction.BUY)
                .confidence(74)
                .reasons(List.of("Breakout above the *weekly* range"))
                .tradeSetup(new TradeSetup("A", 1.0845, 1.0795, 1.0945, null, "Pullback"))
                .createdAt(AT)
                .build();

        String text = renderer.renderSignalAlert(signal, null, "FX:EURUSD 1h", true);

        assertTrue(text.startsWith("🤖 *Trade Analysis Alert*"));
        assertTrue(text.contains("*FX:EURUSD 1h*"));
        assertTrue(text.contains("2026-03-02 09:05 UTC"));
        assertTrue(text.contains("📈 BUY"));
        assertTrue(text.contains("74% 🟢🟢⚪"));
        assertTrue(text.contains("Entry: `1.08450`"));
        assertTrue(text.contains("R:R Ratio: `1:2.00`"));
        assertTrue(text.contains("\\*weekly\\*"));
        assertTrue(text.endsWith("(https://app.example.com/analysis/31)"));
        assertFalse(text.contains("Economic Risk"));
    }

    @Test
    void renderSignalAlert_shouldShowEconomicLinesOnlyWhenIncludedAndNotNeutral() {
        Signal signal = Signal.builder().id(1L).action(SignalAction.SELL).confidence(55).createdAt(AT).build();
        EconomicContext economic = EconomicContext.builder()
                .signalId(1L)
                .immediateRisk(RiskLevel.HIGH)
                .weeklyOutlook(WeeklyOutlook.NEUTRAL)
                .build();

        String shown = renderer.renderSignalAlert(signal, economic, "Layout", true);
        String hidden = renderer.renderSignalAlert(signal, economic, "Layout", false);

        assertTrue(shown.contains("*Economic Risk:* HIGH"));
        assertFalse(shown.contains("Weekly Outlook"));
        assertFalse(hidden.contains("Economic Risk"));
    }

    @Test
    void renderSignalAlert_shouldOmitSetupForHold() {
        Signal signal = Signal.builder()
                .action(SignalAction.HOLD)
                .confidence(20)
                .tradeSetup(new TradeSetup("B", 100.0, 95.0, 110.0, 2.0, null))
                .createdAt(AT)
                .build();

        String text = renderer.renderSignalAlert(signal, null, null, false);

        assertTrue(text.contains("*Chart*"));
        assertTrue(text.contains("🔴⚪⚪"));
        assertFalse(text.contains("Trade Setup"));
        assertFalse(text.contains("*Analysis:*"));
    }

    @Test
    void renderErrorAlert_shouldTruncateAndEscape() {
        String text = renderer.renderErrorAlert("my_layout", "x".repeat(400), AT);

        assertTrue(text.contains("my\\_layout"));
        assertTrue(text.contains("x".repeat(300) + "..."));
        assertFalse(text.contains("x".repeat(301)));
        assertTrue(text.contains("2026-03-02 09:05 UTC"));
    }

    @Test
    void formatPrice_shouldScaleDecimalsWithMagnitude() {
        assertEquals("1.08450", TelegramAlertRenderer.formatPrice(1.0845));
        assertEquals("151.230", TelegramAlertRenderer.formatPrice(151.23));
        assertEquals("64250.50", TelegramAlertRenderer.formatPrice(64250.5));
    }
}
