package com.deepansh.historyagent.exception;

/**
 * Base type for every failure raised by the agent pipeline.
 * Unchecked so stage code can let it propagate to the orchestrator.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
