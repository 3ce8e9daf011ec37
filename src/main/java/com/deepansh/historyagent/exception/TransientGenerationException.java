package com.deepansh.historyagent.exception;

/**
 * Retryable provider failure: 429, 5xx or a network error.
 * Converted to {@link GenerationUnavailableException} once retries are exhausted.
 */
public class TransientGenerationException extends AgentException {

    public TransientGenerationException(String message) {
        super(message);
    }

    public TransientGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
