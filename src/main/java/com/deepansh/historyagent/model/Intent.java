package com.deepansh.historyagent.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Classified purpose of a user query. Wire names match the planner schema.
 */
public enum Intent {

    FACTUAL_QUERY("factual_query"),
    INSIGHT_ANALYSIS("insight_analysis"),
    RECOMMENDATION("recommendation"),
    OTHER("other");

    private final String wireName;

    Intent(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<Intent> fromWireName(String value) {
        if (value == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(i -> i.wireName.equals(value.trim()))
                .findFirst();
    }
}
