package com.deepansh.historyagent.model;

public enum ErrorKind {
    PARSE_ERROR,
    ARGUMENT_RESOLUTION_ERROR,
    TOOL_EXECUTION_ERROR,
    TIMEOUT,
    GENERATION_UNAVAILABLE,
    CANCELLED,
    INTERNAL
}
