package com.deepansh.historyagent.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One planned tool invocation. {@code rawArgsSpec} holds whatever the planner proposed,
 * possibly incomplete (e.g. a relative {@code time_range} instead of concrete dates).
 */
@Value
public class ToolCall {

    String name;
    Map<String, Object> rawArgsSpec;

    /** Planner's one-line reason for choosing this tool */
    String reasoning;

    public static ToolCall of(String name, Map<String, Object> rawArgsSpec) {
        return of(name, rawArgsSpec, null);
    }

    public static ToolCall of(String name, Map<String, Object> rawArgsSpec, String reasoning) {
        Map<String, Object> copy = rawArgsSpec == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(rawArgsSpec));
        return new ToolCall(name, copy, reasoning);
    }
}
