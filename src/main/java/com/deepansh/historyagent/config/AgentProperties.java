package com.deepansh.historyagent.config;

import com.deepansh.historyagent.resilience.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Strongly-typed configuration for the agent pipeline.
 * Bound from application.yml under the "agent" prefix; read once at construction,
 * never during a turn.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /** Retries after the first intent-parse attempt; total attempts = retries + 1 */
    private int maxIntentParseRetries = 2;

    private int maxToolCallAttempts = 3;
    private Duration perCallTimeout = Duration.ofSeconds(10);
    private Duration aggregateFetchTimeout = Duration.ofSeconds(30);

    /** Upper bound, in UTF-8 bytes, of every stored tool payload */
    private int truncationByteBudget = 4000;

    /** Empty means the provider's default model */
    private String modelIdentifierForStructuredGen = "";
    private String modelIdentifierForSynthesis = "";

    /** Per-attempt bound on a structured-generation call made by the intent parser */
    private Duration generationTimeout = Duration.ofSeconds(60);

    /** Worker threads for concurrent tool calls */
    private int fetchParallelism = 4;

    private Backoff backoff = new Backoff();
    private History history = new History();
    private Conversation conversation = new Conversation();

    @Data
    public static class Backoff {
        private Duration initialInterval = Duration.ofMillis(200);
        private double multiplier = 2.0;
        private Duration maxInterval = Duration.ofSeconds(2);
    }

    @Data
    public static class History {
        private String dataDirectory = "./data/listening-history";
        private String filePattern = "*.json";
        /** Zone plays are converted to before any date arithmetic */
        private String zone = "UTC";
    }

    @Data
    public static class Conversation {
        /** Conversations with no turn for this long are dropped */
        private Duration idleTtl = Duration.ofMinutes(60);
        private int maxConversations = 1000;
    }

    public RetryPolicy intentParsePolicy() {
        return RetryPolicy.builder()
                .name("intent-parse")
                .maxAttempts(maxIntentParseRetries + 1)
                .perCallTimeout(generationTimeout)
                .initialBackoff(backoff.getInitialInterval())
                .backoffMultiplier(backoff.getMultiplier())
                .maxBackoff(backoff.getMaxInterval())
                .build();
    }

    /** One bounded attempt; used for synthesis and argument filling, which are not retried here */
    public RetryPolicy singleGenerationPolicy(String name) {
        return RetryPolicy.builder()
                .name(name)
                .maxAttempts(1)
                .perCallTimeout(generationTimeout)
                .initialBackoff(backoff.getInitialInterval())
                .backoffMultiplier(backoff.getMultiplier())
                .maxBackoff(backoff.getMaxInterval())
                .build();
    }

    public RetryPolicy toolCallPolicy(String toolName) {
        return RetryPolicy.builder()
                .name("tool-" + toolName)
                .maxAttempts(maxToolCallAttempts)
                .perCallTimeout(perCallTimeout)
                .initialBackoff(backoff.getInitialInterval())
                .backoffMultiplier(backoff.getMultiplier())
                .maxBackoff(backoff.getMaxInterval())
                .build();
    }
}
