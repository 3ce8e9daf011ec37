package com.deepansh.historyagent.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Terminal outcome of one planned tool call. Exactly one exists per entry of the tool plan.
 */
@Value
@Builder
public class FetchResult {

    String toolName;
    FetchStatus status;

    /** Serialized result, already cut to the truncation budget. Null unless status is OK. */
    String payload;

    boolean truncated;

    /** Attempts made against the query service; 0 when arguments were rejected */
    int attempts;

    @Builder.Default
    Map<String, Object> resolvedArguments = Map.of();

    /** Failure description; null for successful calls, including ones that succeeded on a retry */
    String error;

    public boolean isOk() {
        return status == FetchStatus.OK;
    }

    public static FetchResult ok(String toolName, String payload, boolean truncated,
                                 int attempts, Map<String, Object> arguments) {
        return FetchResult.builder()
                .toolName(toolName)
                .status(FetchStatus.OK)
                .payload(payload)
                .truncated(truncated)
                .attempts(attempts)
                .resolvedArguments(arguments)
                .build();
    }

    public static FetchResult failed(String toolName, String error, int attempts, Map<String, Object> arguments) {
        return FetchResult.builder()
                .toolName(toolName)
                .status(FetchStatus.FAILED)
                .attempts(attempts)
                .resolvedArguments(arguments == null ? Map.of() : arguments)
                .error(error)
                .build();
    }

    public static FetchResult timedOut(String toolName, String error, int attempts, Map<String, Object> arguments) {
        return FetchResult.builder()
                .toolName(toolName)
                .status(FetchStatus.TIMED_OUT)
                .attempts(attempts)
                .resolvedArguments(arguments == null ? Map.of() : arguments)
                .error(error)
                .build();
    }
}
