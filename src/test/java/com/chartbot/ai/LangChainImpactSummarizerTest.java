package com.chartbot.ai;

import com.chartbot.automation.error.EnrichmentException;
import com.chartbot.model.EconomicEvent;
import com.chartbot.model.ImpactLevel;
import com.chartbot.model.RiskLevel;
import com.chartbot.model.Signal;
import com.chartbot.model.SignalAction;
import com.chartbot.model.WeeklyOutlook;
import dev.langchain4j.model.chat.ChatLanguageModel;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LangChainImpactSummarizerTest {
    private static final Signal BUY = Signal.builder().action(SignalAction.BUY).confidence(70).build();
    private static final List<EconomicEvent> UPCOMING = List.of(
            event("cpi", ImpactLevel.HIGH),
            event("fomc", ImpactLevel.HIGH)
    );

    @Test
    void summarize_shouldParseModelReply() throws Exception {
        LangChainImpactSummarizer summarizer = new LangChainImpactSummarizer(new ScriptedModel(
                "```json\n{\"impactSummary\":\"CPI and FOMC today\",\"immediateRisk\":\"extreme\",\"weeklyOutlook\":\"volatile\","
                        + "\"warnings\":[\"Spread widening\",\" \"],\"opportunities\":[],\"recommendation\":\"Wait for the release\"}\n```"));

        ImpactSummary summary = summarizer.summarize("EURUSD", BUY, UPCOMING, List.of());

        assertEquals(RiskLevel.EXTREME, summary.immediateRisk);
        assertEquals(WeeklyOutlook.VOLATILE, summary.weeklyOutlook);
        assertEquals(List.of("Spread widening"), summary.warnings);
        assertEquals("Wait for the release", summary.recommendation);
    }

    @Test
    void summarize_shouldRejectIncompleteReply() {
        LangChainImpactSummarizer summarizer = new LangChainImpactSummarizer(
                new ScriptedModel("{\"impactSummary\":\"x\",\"immediateRisk\":\"severe\"}"));

        assertThrows(EnrichmentException.class, () -> summarizer.summarize("EURUSD", BUY, UPCOMING, List.of()));
    }

    @Test
    void summarize_shouldUseRuleBasedSummaryWithoutModel() throws Exception {
        LangChainImpactSummarizer summarizer = new LangChainImpactSummarizer((ChatLanguageModel) null);

        ImpactSummary summary = summarizer.summarize("EURUSD", BUY, UPCOMING, List.of(event("nfp", ImpactLevel.MEDIUM)));

        assertEquals(RiskLevel.EXTREME, summary.immediateRisk);
        assertEquals(WeeklyOutlook.NEUTRAL, summary.weeklyOutlook);
        assertTrue(summary.impactSummary.startsWith("3 economic events"));
        assertEquals(1, summary.warnings.size());
        assertTrue(summary.recommendation.contains("BUY on EURUSD"));
    }

    @Test
    void constructor_shouldFallBackToRulesWhenNamedModelIsDisabled() throws Exception {
        ScriptedModel ollama = new ScriptedModel("{}");
        LangChainImpactSummarizer summarizer = new LangChainImpactSummarizer(
                new ChatModelRegistry(Map.of("ollama", ollama), "ollama"), "openai");

        summarizer.summarize("EURUSD", BUY, List.of(), List.of());

        assertTrue(ollama.calls.isEmpty());
    }

    private static EconomicEvent event(String id, ImpactLevel impact) {
        return new EconomicEvent(id, Instant.parse("2026-03-02T09:30:00Z"), "US", "USD", id.toUpperCase(),
                impact, null, null, null, null, "fmp");
    }
}
