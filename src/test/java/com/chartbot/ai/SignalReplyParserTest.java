package com.chartbot.ai;

import com.chartbot.automation.error.AnalysisProviderException;
import com.chartbot.model.Signal;
import com.chartbot.model.SignalAction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalReplyParserTest {

    @Test
    void parse_shouldReadFencedReplyWithTradeSetup() throws Exception {
        String reply = "Here is my analysis:\n```json\n{\"action\":\"buy\",\"confidence\":72.6,\"timeframe\":\"Swing\","
                + "\"reasons\":[\"Higher lows\",\"RSI above 50\"],"
                + "\"tradeSetup\":{\"quality\":\"a\",\"entryPrice\":1.0845,\"stopLoss\":\"1.0790\",\"targetPrice\":1.095,"
                + "\"riskRewardRatio\":2,\"setupDescription\":\"Pullback entry\"}}\n```";

        Signal signal = SignalReplyParser.parse(reply, "openai");

        assertEquals(SignalAction.BUY, signal.action);
        assertEquals(73, signal.confidence);
        assertEquals("swing", signal.timeframe);
        assertEquals(2, signal.reasons.size());
        assertEquals("openai", signal.model);
        assertEquals("A", signal.tradeSetup.quality);
        assertEquals(1.079, signal.tradeSetup.stopLoss, 1e-9);
        assertTrue(signal.tradeSetup.hasLevels());
    }

    @Test
    void parse_shouldDropUnknownSetupQuality() throws Exception {
        Signal signal = SignalReplyParser.parse("{\"action\":\"HOLD\",\"confidence\":40,\"timeframe\":\"long\","
                + "\"reasons\":[\"Range\"],\"tradeSetup\":{\"quality\":\"Z\",\"entryPrice\":\"n/a\"}}", "ollama");

        assertNull(signal.tradeSetup.quality);
        assertNull(signal.tradeSetup.entryPrice);
    }

    @Test
    void parse_shouldRejectInvalidReplies() {
        assertThrows(AnalysisProviderException.class, () -> SignalReplyParser.parse("no json here", "m"));
        assertThrows(AnalysisProviderException.class, () -> SignalReplyParser.parse(
                "{\"action\":\"STRONG_BUY\",\"confidence\":50,\"timeframe\":\"swing\",\"reasons\":[\"x\"]}", "m"));
        assertThrows(AnalysisProviderException.class, () -> SignalReplyParser.parse(
                "{\"action\":\"BUY\",\"confidence\":\"high\",\"timeframe\":\"swing\",\"reasons\":[\"x\"]}", "m"));
        assertThrows(AnalysisProviderException.class, () -> SignalReplyParser.parse(
                "{\"action\":\"BUY\",\"confidence\":101,\"timeframe\":\"swing\",\"reasons\":[\"x\"]}", "m"));
        assertThrows(AnalysisProviderException.class, () -> SignalReplyParser.parse(
                "{\"action\":\"BUY\",\"confidence\":50,\"timeframe\":\"weekly\",\"reasons\":[\"x\"]}", "m"));
        assertThrows(AnalysisProviderException.class, () -> SignalReplyParser.parse(
                "{\"action\":\"BUY\",\"confidence\":50,\"timeframe\":\"swing\",\"reasons\":[]}", "m"));
        assertThrows(AnalysisProviderException.class, () -> SignalReplyParser.parse(
                "{\"action\":\"BUY\",\"confidence\":50,\"timeframe\":\"swing\",\"reasons\":[1]}", "m"));
    }

    @Test
    void parse_shouldAcceptConfidenceBounds() throws Exception {
        assertEquals(0, SignalReplyParser.parse(
                "{\"action\":\"SELL\",\"confidence\":0,\"timeframe\":\"intraday\",\"reasons\":[\"x\"]}", "m").confidence);
        assertEquals(100, SignalReplyParser.parse(
                "{\"action\":\"SELL\",\"confidence\":100,\"timeframe\":\"intraday\",\"reasons\":[\"x\"]}", "m").confidence);
    }
}
