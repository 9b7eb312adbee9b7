package com.chartbot.config;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Flat key/value view over the bound application properties, used by the adapters.
 * Keys are dotted and kebab-case ({@code capture.api-key}); blank values fall back to defaults.
 */
public final class Config {
    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();

    private Config() {
    }

    /**
     * Nested maps become dotted keys; lists and arrays become comma-joined values.
     */
    public static Config fromConfigurationProperties(Map<String, ?> rawProperties) {
        Config config = new Config();
        config.flatten("", rawProperties);
        return config;
    }

    public static Config of(Map<String, String> values) {
        Config config = new Config();
        if (values != null) {
            values.forEach(config::put);
        }
        return config;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public double getDouble(String key, double fallback) {
        try {
            return Double.parseDouble(getString(key).trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private void flatten(String prefix, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (!key.isEmpty()) {
                    flatten(prefix.isEmpty() ? key : prefix + "." + key, entry.getValue());
                }
            }
            return;
        }
        List<Object> items = asItems(value);
        if (items == null) {
            put(prefix, String.valueOf(value));
            return;
        }
        List<String> parts = new ArrayList<>(items.size());
        for (Object item : items) {
            parts.add(item == null ? "" : String.valueOf(item));
        }
        put(prefix, String.join(",", parts));
    }

    private static List<Object> asItems(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (!value.getClass().isArray()) {
            return null;
        }
        int len = Array.getLength(value);
        List<Object> items = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            items.add(Array.get(value, i));
        }
        return items;
    }

    private void put(String key, String value) {
        if (key == null || key.isBlank()) {
            return;
        }
        props.setProperty(key.trim(), value == null ? "" : value);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();
        defaults.put("app.url", "http://localhost:3000");

        defaults.put("capture.base-url", "https://api.chart-img.com");
        defaults.put("capture.width", "800");
        defaults.put("capture.height", "600");

        defaults.put("ai.default-model", "ollama");
        defaults.put("ai.temperature", "0.2");
        defaults.put("ai.timeout-seconds", "120");
        defaults.put("ai.ollama.base-url", "");
        defaults.put("ai.ollama.model", "llava:13b");
        defaults.put("ai.openai.model", "gpt-4o");
        defaults.put("ai.openai.max-tokens", "1000");

        defaults.put("economic.base-url", "https://financialmodelingprep.com/api/v3");
        defaults.put("economic.cache-hours", "6");
        defaults.put("economic.daily-request-limit", "250");
        defaults.put("economic.request-timeout-seconds", "20");
        defaults.put("economic.summarizer-model", "");

        defaults.put("telegram.api-base-url", "https://api.telegram.org");
        defaults.put("telegram.request-timeout-seconds", "30");
        return Collections.unmodifiableMap(defaults);
    }
}
