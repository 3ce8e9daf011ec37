package com.deepansh.historyagent.model;

import lombok.Builder;
import lombok.Value;

/**
 * A recoverable (or, for {@link AgentState#getFailure()}, fatal) error noted during a turn.
 * Kept for observability only; correctness never depends on it.
 */
@Value
@Builder
public class ErrorRecord {

    Stage stage;
    ErrorKind kind;

    /** Set when the error belongs to a single tool call */
    String toolName;

    String message;

    public static ErrorRecord of(Stage stage, ErrorKind kind, String message) {
        return new ErrorRecord(stage, kind, null, message);
    }

    public static ErrorRecord forTool(Stage stage, ErrorKind kind, String toolName, String message) {
        return new ErrorRecord(stage, kind, toolName, message);
    }
}
