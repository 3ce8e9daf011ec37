package com.deepansh.historyagent.llm;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderSettingsTest {

    private static MockEnvironment groq() {
        return new MockEnvironment()
                .withProperty("groq.api-key", "gsk_1234567890abcdef")
                .withProperty("groq.base-url", "https://api.groq.com/openai/v1")
                .withProperty("groq.model", "llama-3.3-70b-versatile")
                .withProperty("groq.max-tokens", "1024")
                .withProperty("groq.temperature", "0.5");
    }

    @Test
    void fromEnvironment_blankOverrides_useProviderModel() {
        ProviderSettings settings = ProviderSettings.fromEnvironment(groq(), "GROQ", "", null);

        assertThat(settings.getName()).isEqualTo("groq");
        assertThat(settings.getStructuredModel()).isEqualTo("llama-3.3-70b-versatile");
        assertThat(settings.getSynthesisModel()).isEqualTo("llama-3.3-70b-versatile");
        assertThat(settings.getMaxTokens()).isEqualTo(1024);
        assertThat(settings.getTemperature()).isEqualTo(0.5);
    }

    @Test
    void fromEnvironment_overridesPerPurpose() {
        ProviderSettings settings = ProviderSettings.fromEnvironment(groq(), "groq", "planner", "writer");

        assertThat(settings.getStructuredModel()).isEqualTo("planner");
        assertThat(settings.getSynthesisModel()).isEqualTo("writer");
        assertThat(settings.getDefaultModel()).isEqualTo("llama-3.3-70b-versatile");
    }

    @Test
    void fromEnvironment_unknownProvider_fails() {
        assertThatThrownBy(() -> ProviderSettings.fromEnvironment(groq(), "mistral", "", ""))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void maskedApiKey_neverPrintsWholeKey() {
        ProviderSettings settings = ProviderSettings.fromEnvironment(groq(), "groq", "", "");

        assertThat(settings.maskedApiKey()).isEqualTo("gsk_1234...cdef");
        assertThat(settings.toString()).doesNotContain("gsk_1234567890abcdef");
        assertThat(settings.apiKeyVariable()).isEqualTo("GROQ_API_KEY");
    }

    @Test
    void hasApiKey_falseWhenUnset() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("openai.base-url", "https://api.openai.com/v1")
                .withProperty("openai.model", "gpt-4o-mini");

        ProviderSettings settings = ProviderSettings.fromEnvironment(env, "openai", "", "");

        assertThat(settings.hasApiKey()).isFalse();
        assertThat(settings.maskedApiKey()).isEmpty();
        assertThat(settings.getMaxTokens()).isEqualTo(2048);
    }
}
