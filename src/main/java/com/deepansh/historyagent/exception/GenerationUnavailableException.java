package com.deepansh.historyagent.exception;

/**
 * The structured-generation collaborator could not be reached on any attempt.
 * This is the only failure that moves a turn to FAILED.
 */
public class GenerationUnavailableException extends AgentException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
