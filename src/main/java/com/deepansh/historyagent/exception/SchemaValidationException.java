package com.deepansh.historyagent.exception;

import java.util.List;

/**
 * A generated value did not conform to the requested schema.
 */
public class SchemaValidationException extends AgentException {

    private final List<String> violations;

    public SchemaValidationException(String message, List<String> violations) {
        super(message + (violations.isEmpty() ? "" : ": " + String.join("; ", violations)));
        this.violations = List.copyOf(violations);
    }

    public SchemaValidationException(String message) {
        this(message, List.of());
    }

    public SchemaValidationException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of();
    }

    public List<String> getViolations() {
        return violations;
    }
}
