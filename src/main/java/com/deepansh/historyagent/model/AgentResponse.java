package com.deepansh.historyagent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentResponse {

    private String conversationId;
    private Stage stage;
    private Intent intent;
    private boolean intentDegraded;

    /** Final answer for DONE turns, the generic failure message for FAILED ones, null otherwise */
    private String response;

    @Builder.Default
    private List<FetchSummary> fetchResults = new ArrayList<>();

    @Builder.Default
    private List<ErrorRecord> errorTrace = new ArrayList<>();

    public record FetchSummary(String toolName, FetchStatus status, boolean truncated, int attempts) {}

    public static AgentResponse from(AgentState state, String failureMessage) {
        String text = switch (state.getStage()) {
            case DONE -> state.getFinalResponse();
            case FAILED -> failureMessage;
            default -> null;
        };
        return AgentResponse.builder()
                .conversationId(state.getConversationId())
                .stage(state.getStage())
                .intent(state.getIntent())
                .intentDegraded(state.isIntentDegraded())
                .response(text)
                .fetchResults(state.getFetchResults().stream()
                        .map(r -> new FetchSummary(r.getToolName(), r.getStatus(), r.isTruncated(), r.getAttempts()))
                        .toList())
                .errorTrace(state.getErrorTrace())
                .build();
    }
}
