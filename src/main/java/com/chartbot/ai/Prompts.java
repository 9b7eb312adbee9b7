package com.chartbot.ai;

import com.chartbot.model.EconomicEvent;
import com.chartbot.model.Signal;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

final class Prompts {
    private Prompts() {
    }

    static String buildChartAnalysisPrompt() {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("You are an expert technical analyst and professional trader.\n");
        sb.append("Analyze the attached TradingView chart image and return ONLY valid JSON.\n\n");
        sb.append("Price reading:\n");
        sb.append("1) Read prices from the right edge price scale and the ticker area, without rounding.\n");
        sb.append("2) Use the instrument's real magnitude (BTC in tens of thousands, gold in thousands, forex with 4-5 decimals).\n");
        sb.append("3) Entry and stop loss must be different prices at logical technical levels.\n");
        sb.append("4) For BUY the stop is below entry, for SELL above.\n\n");
        sb.append("JSON format:\n");
        sb.append("{\n");
        sb.append("  \"action\": \"BUY\" | \"SELL\" | \"HOLD\",\n");
        sb.append("  \"confidence\": <0-100>,\n");
        sb.append("  \"timeframe\": \"intraday\" | \"swing\" | \"long\",\n");
        sb.append("  \"reasons\": [\"specific observation with price levels\", \"...\"],\n");
        sb.append("  \"tradeSetup\": {\n");
        sb.append("    \"quality\": \"A\" | \"B\" | \"C\",\n");
        sb.append("    \"entryPrice\": <number>,\n");
        sb.append("    \"stopLoss\": <number>,\n");
        sb.append("    \"targetPrice\": <number>,\n");
        sb.append("    \"riskRewardRatio\": <number>,\n");
        sb.append("    \"setupDescription\": \"entry, stop and target reasoning with the same prices\"\n");
        sb.append("  }\n");
        sb.append("}\n\n");
        sb.append("Give 5-7 reasons. Set tradeSetup to null only when the chart is unreadable.");
        return sb.toString();
    }

    static String buildEconomicImpactPrompt(
            String symbol,
            Signal signal,
            List<EconomicEvent> upcoming,
            List<EconomicEvent> weekly
    ) {
        String action = signal == null || signal.action == null ? "HOLD" : signal.action.name();
        int confidence = signal == null ? 0 : signal.confidence;
        StringBuilder sb = new StringBuilder(4096);
        sb.append("You are an expert fundamental analyst and economist specializing in market events.\n\n");
        sb.append("Analyze how these economic events will impact a ").append(action)
                .append(" position on ").append(symbol)
                .append(" (current signal confidence: ").append(confidence).append("%).\n\n");
        sb.append("IMMEDIATE EVENTS (within 1 hour):\n").append(eventsJson(upcoming)).append("\n\n");
        sb.append("WEEKLY EVENTS (within 7 days):\n").append(eventsJson(weekly)).append("\n\n");
        sb.append("Return ONLY valid JSON:\n");
        sb.append("{\n");
        sb.append("  \"impactSummary\": \"2-3 sentence overview\",\n");
        sb.append("  \"immediateRisk\": \"NONE\" | \"LOW\" | \"MEDIUM\" | \"HIGH\" | \"EXTREME\",\n");
        sb.append("  \"weeklyOutlook\": \"BULLISH\" | \"BEARISH\" | \"NEUTRAL\" | \"VOLATILE\",\n");
        sb.append("  \"warnings\": [\"...\"],\n");
        sb.append("  \"opportunities\": [\"...\"],\n");
        sb.append("  \"recommendation\": \"take the trade now, wait, or modify\"\n");
        sb.append("}\n\n");
        sb.append("Consider event timing, forecast versus previous values and currency correlations.");
        return sb.toString();
    }

    private static String eventsJson(List<EconomicEvent> events) {
        JSONArray arr = new JSONArray();
        if (events != null) {
            for (EconomicEvent event : events) {
                JSONObject row = new JSONObject();
                row.put("time", event.time.toString());
                row.put("country", event.country);
                row.put("event", event.title);
                row.put("impact", event.impact.name());
                row.put("category", event.category);
                row.put("forecast", event.forecast == null ? JSONObject.NULL : event.forecast);
                row.put("previous", event.previous == null ? JSONObject.NULL : event.previous);
                row.put("actual", event.actual == null ? JSONObject.NULL : event.actual);
                arr.put(row);
            }
        }
        return arr.toString(2);
    }
}
