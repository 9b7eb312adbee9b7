package com.chartbot.ai;

import com.chartbot.automation.error.AnalysisProviderException;
import com.chartbot.model.ImageRef;
import com.chartbot.model.Signal;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Base64;
import java.util.List;

/**
 * Sends the chart image with the analysis prompt to the selected LangChain4j model.
 */
public final class LangChainChartAnalyzer implements ChartAnalyzer {
    private static final Logger LOG = LogManager.getLogger(LangChainChartAnalyzer.class);

    private final ChatModelRegistry registry;

    public LangChainChartAnalyzer(ChatModelRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Signal analyze(ImageRef image, String selectedModel) throws AnalysisProviderException {
        ChatLanguageModel model = registry.find(selectedModel)
                .orElseThrow(() -> new AnalysisProviderException("analysis model not enabled: " + selectedModel));
        if (image == null || image.size() == 0) {
            throw new AnalysisProviderException("no image to analyze");
        }

        String base64 = Base64.getEncoder().encodeToString(image.bytes());
        List<ChatMessage> messages = List.of(UserMessage.from(
                TextContent.from(Prompts.buildChartAnalysisPrompt()),
                ImageContent.from(base64, image.mimeType)
        ));

        String reply;
        try {
            Response<AiMessage> response = model.generate(messages);
            reply = response == null || response.content() == null ? null : response.content().text();
        } catch (RuntimeException e) {
            throw new AnalysisProviderException("model " + selectedModel + " call failed: " + e.getMessage(), e);
        }
        if (reply == null || reply.isBlank()) {
            throw new AnalysisProviderException("model " + selectedModel + " returned an empty reply");
        }
        Signal signal = SignalReplyParser.parse(reply, selectedModel);
        LOG.debug("analysis ok model={} action={} confidence={}", selectedModel, signal.action, signal.confidence);
        return signal;
    }
}
