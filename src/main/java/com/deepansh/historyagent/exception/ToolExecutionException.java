package com.deepansh.historyagent.exception;

/**
 * Raised when a query tool invocation fails.
 * Retryable failures are retried with backoff; the rest fail the call immediately.
 */
public class ToolExecutionException extends AgentException {

    private final boolean retryable;

    public ToolExecutionException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public ToolExecutionException(String message) {
        this(message, null, true);
    }

    private ToolExecutionException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static ToolExecutionException nonRetryable(String message, Throwable cause) {
        return new ToolExecutionException(message, cause, false);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
