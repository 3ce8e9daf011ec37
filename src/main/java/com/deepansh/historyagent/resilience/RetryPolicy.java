package com.deepansh.historyagent.resilience;

import io.github.resilience4j.core.IntervalFunction;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Attempt budget, per-attempt timeout and exponential backoff for one kind of call.
 * Applied by {@link PolicyExecutor}; shared by intent parsing and tool execution.
 */
@Value
@Builder
public class RetryPolicy {

    String name;
    int maxAttempts;
    Duration perCallTimeout;
    Duration initialBackoff;
    double backoffMultiplier;
    Duration maxBackoff;

    public IntervalFunction backoff() {
        return IntervalFunction.ofExponentialBackoff(initialBackoff, backoffMultiplier, maxBackoff);
    }
}
