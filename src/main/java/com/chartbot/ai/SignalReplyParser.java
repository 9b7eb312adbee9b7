package com.chartbot.ai;

import com.chartbot.automation.error.AnalysisProviderException;
import com.chartbot.model.Signal;
import com.chartbot.model.SignalAction;
import com.chartbot.model.TradeSetup;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses and validates the analysis model's JSON reply.
 */
final class SignalReplyParser {
    private static final Set<String> TIMEFRAMES = Set.of("intraday", "swing", "long");
    private static final Set<String> QUALITIES = Set.of("A", "B", "C");

    private SignalReplyParser() {
    }

    static Signal parse(String reply, String model) throws AnalysisProviderException {
        JSONObject json;
        try {
            json = JsonReplies.extractObject(reply);
        } catch (JSONException e) {
            throw new AnalysisProviderException("unparsable analysis reply: " + e.getMessage(), e);
        }

        SignalAction action = SignalAction.fromLabel(json.optString("action", ""));
        if (action == null) {
            throw new AnalysisProviderException("invalid action: " + json.opt("action"));
        }

        Object rawConfidence = json.opt("confidence");
        if (!(rawConfidence instanceof Number)) {
            throw new AnalysisProviderException("confidence must be a number, got: " + rawConfidence);
        }
        double confidence = ((Number) rawConfidence).doubleValue();
        if (!Double.isFinite(confidence) || confidence < 0 || confidence > 100) {
            throw new AnalysisProviderException("confidence out of range 0-100: " + rawConfidence);
        }

        String timeframe = json.optString("timeframe", "").trim().toLowerCase(Locale.ROOT);
        if (!TIMEFRAMES.contains(timeframe)) {
            throw new AnalysisProviderException("invalid timeframe: " + json.opt("timeframe"));
        }

        JSONArray rawReasons = json.optJSONArray("reasons");
        if (rawReasons == null || rawReasons.isEmpty()) {
            throw new AnalysisProviderException("reasons must be a non-empty array");
        }
        List<String> reasons = new ArrayList<>();
        for (int i = 0; i < rawReasons.length(); i++) {
            Object item = rawReasons.opt(i);
            if (!(item instanceof String)) {
                throw new AnalysisProviderException("reasons must contain only strings");
            }
            reasons.add((String) item);
        }

        return Signal.builder()
                .model(model)
                .action(action)
                .confidence((int) Math.round(confidence))
                .timeframe(timeframe)
                .reasons(List.copyOf(reasons))
                .tradeSetup(parseTradeSetup(json.optJSONObject("tradeSetup")))
                .build();
    }

    /**
     * Trade setup is advisory; a malformed one is dropped rather than failing the analysis.
     */
    private static TradeSetup parseTradeSetup(JSONObject json) {
        if (json == null) {
            return null;
        }
        String quality = json.optString("quality", "").trim().toUpperCase(Locale.ROOT);
        return new TradeSetup(
                QUALITIES.contains(quality) ? quality : null,
                number(json, "entryPrice"),
                number(json, "stopLoss"),
                number(json, "targetPrice"),
                number(json, "riskRewardRatio"),
                json.optString("setupDescription", "")
        );
    }

    private static Double number(JSONObject json, String key) {
        Object raw = json.opt(key);
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            return Double.isFinite(value) ? value : null;
        }
        if (raw instanceof String) {
            try {
                return Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}
