package com.deepansh.historyagent.llm;

import com.deepansh.historyagent.config.AgentProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.web.client.RestClient;

/**
 * Creates the HTTP generation client for the provider selected by LLM_PROVIDER.
 * The agent never sees this bean directly: ResilientGenerationClient wraps it
 * with retry + circuit breaker and is the @Primary GenerationClient.
 */
@Configuration
@Slf4j
public class GenerationClientConfig {

    @Value("${llm.provider:groq}")
    private String provider;

    @Bean
    public ProviderSettings providerSettings(Environment environment, AgentProperties agentProperties) {
        ProviderSettings settings = ProviderSettings.fromEnvironment(environment, provider,
                agentProperties.getModelIdentifierForStructuredGen(),
                agentProperties.getModelIdentifierForSynthesis());

        log.info("================================================================");
        log.info("  Active LLM Provider : {}", settings.getName().toUpperCase());
        log.info("  Structured model    : {}", settings.getStructuredModel());
        log.info("  Synthesis model     : {}", settings.getSynthesisModel());
        if (settings.hasApiKey()) {
            log.info("  Key: {}", settings.maskedApiKey());
        } else {
            log.error("  {} API key not set! Set env var: {}={your-key}",
                    settings.getName().toUpperCase(), settings.apiKeyVariable());
        }
        log.info("================================================================");
        return settings;
    }

    @Bean("generationHttpClient")
    public GenerationClient generationHttpClient(ProviderSettings settings,
                                                 ObjectMapper objectMapper,
                                                 JsonSchemaValidator validator,
                                                 RestClient.Builder builder) {
        return new OpenAiGenerationClient(settings, objectMapper, validator, builder.clone());
    }
}
