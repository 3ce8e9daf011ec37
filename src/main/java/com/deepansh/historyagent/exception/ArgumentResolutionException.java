package com.deepansh.historyagent.exception;

import java.util.List;

/**
 * Tool arguments could not be resolved into values matching the tool's parameter schema.
 * The affected call is marked failed without ever reaching the query service.
 */
public class ArgumentResolutionException extends AgentException {

    private final String toolName;

    public ArgumentResolutionException(String toolName, List<String> violations) {
        super("Invalid arguments for tool '" + toolName + "': " + String.join("; ", violations));
        this.toolName = toolName;
    }

    public ArgumentResolutionException(String toolName, String message, Throwable cause) {
        super("Could not resolve arguments for tool '" + toolName + "': " + message, cause);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
