package com.deepansh.historyagent.resilience;

import com.deepansh.historyagent.exception.GenerationUnavailableException;
import com.deepansh.historyagent.exception.TransientGenerationException;
import com.deepansh.historyagent.llm.GenerationClient;
import com.deepansh.historyagent.llm.OutputSchema;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Decorator around the HTTP generation client that adds retry + circuit breaker.
 *
 * @Primary ensures the pipeline gets this bean, not the raw client.
 *
 * Retry config (in application.yml):
 * - retries TransientGenerationException only (network errors, 5xx, 429)
 * - SchemaValidationException and GenerationUnavailableException pass straight through
 *
 * Circuit breaker config:
 * - opens after 50% failure rate in a sliding window of 10 calls
 * - waits 30s before allowing trial calls (half-open state)
 *
 * The Retry aspect wraps the CircuitBreaker aspect, so the fallbacks live on @Retry
 * and see both exhausted transient failures and calls rejected by an open circuit.
 * Both become GenerationUnavailableException; any other exception is rethrown unchanged.
 */
@Component
@Primary
@Slf4j
public class ResilientGenerationClient implements GenerationClient {

    private static final String INSTANCE = "generationClient";

    private final GenerationClient delegate;

    public ResilientGenerationClient(@Qualifier("generationHttpClient") GenerationClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @Retry(name = INSTANCE, fallbackMethod = "structuredFallback")
    @CircuitBreaker(name = INSTANCE)
    public JsonNode generateStructured(OutputSchema schema, String prompt, String context) {
        return delegate.generateStructured(schema, prompt, context);
    }

    @Override
    @Retry(name = INSTANCE, fallbackMethod = "textFallback")
    @CircuitBreaker(name = INSTANCE)
    public String generateText(String personaPrompt, String context) {
        return delegate.generateText(personaPrompt, context);
    }

    public JsonNode structuredFallback(OutputSchema schema, String prompt, String context,
                                       TransientGenerationException ex) {
        log.error("Structured generation [{}] failed after all retries: {}", schema.getName(), ex.getMessage());
        throw new GenerationUnavailableException("Generation service unavailable after retries", ex);
    }

    public JsonNode structuredFallback(OutputSchema schema, String prompt, String context,
                                       CallNotPermittedException ex) {
        log.error("Generation circuit breaker is OPEN, rejecting structured call [{}]", schema.getName());
        throw new GenerationUnavailableException("Generation service circuit is open", ex);
    }

    public String textFallback(String personaPrompt, String context, TransientGenerationException ex) {
        log.error("Text generation failed after all retries: {}", ex.getMessage());
        throw new GenerationUnavailableException("Generation service unavailable after retries", ex);
    }

    public String textFallback(String personaPrompt, String context, CallNotPermittedException ex) {
        log.error("Generation circuit breaker is OPEN, rejecting text call");
        throw new GenerationUnavailableException("Generation service circuit is open", ex);
    }
}
