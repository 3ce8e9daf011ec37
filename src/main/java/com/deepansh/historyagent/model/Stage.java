package com.deepansh.historyagent.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Pipeline stages and the legal transitions between them.
 *
 * INTENT_PARSING → ROUTE → (DATA_FETCHING) → ANALYZING → DONE,
 * with FAILED and CANCELLED reachable from every non-terminal stage.
 */
public enum Stage {

    INTENT_PARSING,
    ROUTE,
    DATA_FETCHING,
    ANALYZING,
    DONE,
    FAILED,
    CANCELLED;

    private static final Map<Stage, Set<Stage>> TRANSITIONS = new EnumMap<>(Stage.class);

    static {
        TRANSITIONS.put(INTENT_PARSING, EnumSet.of(ROUTE, FAILED, CANCELLED));
        TRANSITIONS.put(ROUTE, EnumSet.of(DATA_FETCHING, ANALYZING, FAILED, CANCELLED));
        TRANSITIONS.put(DATA_FETCHING, EnumSet.of(ANALYZING, FAILED, CANCELLED));
        TRANSITIONS.put(ANALYZING, EnumSet.of(DONE, FAILED, CANCELLED));
        TRANSITIONS.put(DONE, EnumSet.noneOf(Stage.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(Stage.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(Stage.class));
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(Stage next) {
        return TRANSITIONS.get(this).contains(next);
    }
}
