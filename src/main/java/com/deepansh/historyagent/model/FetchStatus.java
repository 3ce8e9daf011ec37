package com.deepansh.historyagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FetchStatus {

    OK("ok"),
    FAILED("failed"),
    TIMED_OUT("timed_out");

    private final String wireName;

    FetchStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
