package com.deepansh.historyagent.llm;

import lombok.Builder;
import lombok.Value;
import org.springframework.core.env.Environment;

/**
 * Connection and model settings of the active OpenAI-compatible provider.
 *
 * Structured generation and synthesis may run on different models; a blank
 * override falls back to the provider's default model.
 */
@Value
@Builder
public class ProviderSettings {

    /** Lower-case provider key, also the property prefix: openai, groq or gemini */
    String name;
    String apiKey;
    String baseUrl;
    String defaultModel;
    String structuredModel;
    String synthesisModel;
    int maxTokens;
    double temperature;

    /**
     * Reads {@code <provider>.api-key}, {@code .base-url}, {@code .model},
     * {@code .max-tokens} and {@code .temperature}.
     */
    public static ProviderSettings fromEnvironment(Environment env, String provider,
                                                   String structuredOverride, String synthesisOverride) {
        String name = provider.toLowerCase();
        String model = env.getRequiredProperty(name + ".model");
        return ProviderSettings.builder()
                .name(name)
                .apiKey(env.getProperty(name + ".api-key", ""))
                .baseUrl(env.getRequiredProperty(name + ".base-url"))
                .defaultModel(model)
                .structuredModel(orDefault(structuredOverride, model))
                .synthesisModel(orDefault(synthesisOverride, model))
                .maxTokens(env.getProperty(name + ".max-tokens", Integer.class, 2048))
                .temperature(env.getProperty(name + ".temperature", Double.class, 0.3))
                .build();
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /** First eight and last four characters, for startup logs */
    public String maskedApiKey() {
        if (!hasApiKey()) {
            return "";
        }
        return apiKey.substring(0, Math.min(8, apiKey.length())) + "..."
                + (apiKey.length() > 8 ? apiKey.substring(apiKey.length() - 4) : "");
    }

    public String apiKeyVariable() {
        return name.toUpperCase() + "_API_KEY";
    }

    @Override
    public String toString() {
        return "ProviderSettings[" + name + ", " + baseUrl + ", structured=" + structuredModel
                + ", synthesis=" + synthesisModel + "]";
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
