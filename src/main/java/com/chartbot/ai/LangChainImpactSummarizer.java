package com.chartbot.ai;

import com.chartbot.automation.error.EnrichmentException;
import com.chartbot.data.calendar.EventWindow;
import com.chartbot.model.EconomicEvent;
import com.chartbot.model.RiskLevel;
import com.chartbot.model.Signal;
import com.chartbot.model.WeeklyOutlook;
import dev.langchain4j.model.chat.ChatLanguageModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Economic impact summary through a LangChain4j chat model, or a rule-based one when no model is configured.
 */
public final class LangChainImpactSummarizer implements ImpactSummarizer {
    private static final Logger LOG = LogManager.getLogger(LangChainImpactSummarizer.class);

    private final ChatLanguageModel chatModel;

    public LangChainImpactSummarizer(ChatModelRegistry registry, String modelName) {
        ChatLanguageModel found = null;
        if (modelName != null && !modelName.isBlank()) {
            found = registry.find(modelName).orElse(null);
            if (found == null) {
                LOG.warn("economic summarizer model {} is not enabled, using rule-based summary", modelName);
            }
        }
        this.chatModel = found;
    }

    LangChainImpactSummarizer(ChatLanguageModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public ImpactSummary summarize(String symbol, Signal signal, List<EconomicEvent> upcoming, List<EconomicEvent> weekly)
            throws EnrichmentException {
        if (chatModel == null) {
            return ruleBasedSummary(symbol, signal, upcoming, weekly);
        }
        String prompt = Prompts.buildEconomicImpactPrompt(symbol, signal, upcoming, weekly);
        String reply;
        try {
            reply = chatModel.generate(prompt);
        } catch (RuntimeException e) {
            throw new EnrichmentException("economic impact model call failed: " + e.getMessage(), e);
        }
        try {
            return parse(JsonReplies.extractObject(reply));
        } catch (JSONException e) {
            throw new EnrichmentException("unparsable economic impact reply: " + e.getMessage(), e);
        }
    }

    static ImpactSummary parse(JSONObject json) throws EnrichmentException {
        String summary = json.optString("impactSummary", null);
        RiskLevel risk = RiskLevel.fromLabel(json.optString("immediateRisk", null));
        WeeklyOutlook outlook = WeeklyOutlook.fromLabel(json.optString("weeklyOutlook", null));
        JSONArray warnings = json.optJSONArray("warnings");
        JSONArray opportunities = json.optJSONArray("opportunities");
        String recommendation = json.optString("recommendation", null);
        if (summary == null || risk == null || outlook == null || warnings == null || opportunities == null
                || recommendation == null) {
            throw new EnrichmentException("invalid economic impact reply format");
        }
        return new ImpactSummary(summary, risk, outlook, strings(warnings), strings(opportunities), recommendation);
    }

    static ImpactSummary ruleBasedSummary(String symbol, Signal signal, List<EconomicEvent> upcoming, List<EconomicEvent> weekly) {
        RiskLevel risk = EventWindow.immediateRisk(upcoming);
        String action = signal == null || signal.action == null ? "HOLD" : signal.action.name();
        int total = (upcoming == null ? 0 : upcoming.size()) + (weekly == null ? 0 : weekly.size());
        List<String> warnings = new ArrayList<>();
        if (risk == RiskLevel.HIGH || risk == RiskLevel.EXTREME) {
            warnings.add("High-impact economic events detected within 1 hour");
        }
        return new ImpactSummary(
                total + " economic events detected for " + symbol + ".",
                risk,
                WeeklyOutlook.NEUTRAL,
                warnings,
                List.of(),
                "Review the economic calendar before executing " + action + " on " + symbol + "."
        );
    }

    private static List<String> strings(JSONArray arr) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < arr.length(); i++) {
            String value = arr.optString(i, "").trim();
            if (!value.isEmpty()) {
                out.add(value);
            }
        }
        return out;
    }
}
