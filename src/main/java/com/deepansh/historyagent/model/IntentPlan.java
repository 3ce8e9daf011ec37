package com.deepansh.historyagent.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Validated planner output: the classified intent and the ordered tool plan.
 */
@Value
@Builder
public class IntentPlan {

    Intent intent;

    @Builder.Default
    List<ToolCall> toolPlan = List.of();

    String reasoning;

    /** Optional hint for the insight persona, e.g. "genre diversity over time" */
    String analysisFocus;

    /** True when parsing failed irrecoverably and the plan fell back to OTHER */
    boolean degraded;

    public static IntentPlan degraded(String reason) {
        return IntentPlan.builder()
                .intent(Intent.OTHER)
                .toolPlan(List.of())
                .reasoning(reason)
                .degraded(true)
                .build();
    }
}
