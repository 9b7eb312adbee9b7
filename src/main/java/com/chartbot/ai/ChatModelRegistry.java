package com.chartbot.ai;

import com.chartbot.config.Config;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Vision-capable chat models keyed by the names users pick ({@code ollama}, {@code openai}).
 * A model is enabled only when its configuration is present and the client could be built.
 */
public final class ChatModelRegistry {
    private static final Logger LOG = LogManager.getLogger(ChatModelRegistry.class);

    public static final String OLLAMA = "ollama";
    public static final String OPENAI = "openai";

    private final Map<String, ChatLanguageModel> models;
    private final String defaultModel;

    public ChatModelRegistry(Config config) {
        Map<String, ChatLanguageModel> built = new LinkedHashMap<>();
        Duration timeout = Duration.ofSeconds(Math.max(10, config.getInt("ai.timeout-seconds", 120)));
        double temperature = config.getDouble("ai.temperature", 0.2);

        String ollamaUrl = config.getString("ai.ollama.base-url", "");
        if (!ollamaUrl.isEmpty()) {
            try {
                built.put(OLLAMA, OllamaChatModel.builder()
                        .baseUrl(ollamaUrl)
                        .modelName(config.getString("ai.ollama.model", "llava:13b"))
                        .temperature(temperature)
                        .timeout(timeout)
                        .build());
            } catch (Exception e) {
                LOG.warn("failed to initialize LangChain4j Ollama model: {}", e.getMessage());
            }
        }

        String openAiKey = config.getString("ai.openai.api-key", "");
        if (!openAiKey.isEmpty()) {
            try {
                built.put(OPENAI, OpenAiChatModel.builder()
                        .apiKey(openAiKey)
                        .modelName(config.getString("ai.openai.model", "gpt-4o"))
                        .maxTokens(config.getInt("ai.openai.max-tokens", 1000))
                        .temperature(temperature)
                        .timeout(timeout)
                        .build());
            } catch (Exception e) {
                LOG.warn("failed to initialize LangChain4j OpenAI model: {}", e.getMessage());
            }
        }

        this.models = Collections.unmodifiableMap(built);
        this.defaultModel = normalize(config.getString("ai.default-model", OLLAMA));
        LOG.info("chat models enabled={} default={}", models.keySet(), defaultModel);
    }

    public ChatModelRegistry(Map<String, ChatLanguageModel> models, String defaultModel) {
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        this.defaultModel = normalize(defaultModel);
    }

    public Optional<ChatLanguageModel> find(String name) {
        return Optional.ofNullable(models.get(normalize(name)));
    }

    public boolean isEnabled(String name) {
        return name != null && models.containsKey(normalize(name));
    }

    public String defaultModel() {
        return defaultModel;
    }

    /**
     * The preferred model when it is enabled, otherwise the configured default.
     */
    public String select(String preferred) {
        if (isEnabled(preferred)) {
            return normalize(preferred);
        }
        return defaultModel;
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
