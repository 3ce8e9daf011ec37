package com.deepansh.historyagent.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable state of one conversation turn, threaded through the pipeline.
 *
 * Every stage returns a new instance; fields are only ever added or moved forward:
 * - intent is set once; a plan that could not be parsed arrives already downgraded
 *   to OTHER with intentDegraded set
 * - toolPlan is empty iff intent is OTHER
 * - fetchResults has one entry per planned call once DATA_FETCHING completes
 * - finalResponse is non-null iff stage is DONE
 *
 * Transition methods enforce these rules and throw {@link IllegalStateException}
 * on violation, which always indicates a programming error in a stage.
 */
@Value
@Builder(toBuilder = true)
public class AgentState {

    /** Completed exchanges carried into the next turn; older ones slide out */
    public static final int MAX_HISTORY_TURNS = 20;

    String conversationId;

    @Builder.Default
    List<ConversationTurn> history = List.of();

    String userQuery;
    Intent intent;
    boolean intentDegraded;
    String reasoning;
    String analysisFocus;

    @Builder.Default
    List<ToolCall> toolPlan = List.of();

    @Builder.Default
    List<FetchResult> fetchResults = List.of();

    String finalResponse;
    Stage stage;

    @Builder.Default
    List<ErrorRecord> errorTrace = List.of();

    /** Fatal error that moved the turn to FAILED */
    ErrorRecord failure;

    /**
     * Starts a new turn. With a prior state the conversation id is kept and the
     * prior exchange, if it completed, is appended to the history, which keeps only
     * the last {@link #MAX_HISTORY_TURNS} exchanges.
     */
    public static AgentState newTurn(AgentState prior, String userQuery) {
        if (prior == null) {
            return start(null, userQuery);
        }

        List<ConversationTurn> history = new ArrayList<>(prior.getHistory());
        if (prior.getStage() == Stage.DONE) {
            history.add(new ConversationTurn(prior.getUserQuery(), prior.getFinalResponse()));
        }
        if (history.size() > MAX_HISTORY_TURNS) {
            history = history.subList(history.size() - MAX_HISTORY_TURNS, history.size());
        }

        return AgentState.builder()
                .conversationId(prior.getConversationId() != null
                        ? prior.getConversationId() : UUID.randomUUID().toString())
                .history(List.copyOf(history))
                .userQuery(userQuery)
                .stage(Stage.INTENT_PARSING)
                .build();
    }

    /** First turn of a conversation; a null id is generated */
    public static AgentState start(String conversationId, String userQuery) {
        return AgentState.builder()
                .conversationId(conversationId != null ? conversationId : UUID.randomUUID().toString())
                .userQuery(userQuery)
                .stage(Stage.INTENT_PARSING)
                .build();
    }

    public AgentState withIntentPlan(IntentPlan plan) {
        if (intent != null) {
            throw new IllegalStateException("Intent already set to " + intent);
        }
        boolean other = plan.getIntent() == Intent.OTHER;
        if (!other && plan.getToolPlan().isEmpty()) {
            throw new IllegalStateException("Intent " + plan.getIntent() + " requires a non-empty tool plan");
        }
        return toBuilder()
                .intent(plan.getIntent())
                .intentDegraded(plan.isDegraded())
                .reasoning(plan.getReasoning())
                .analysisFocus(plan.getAnalysisFocus())
                .toolPlan(other ? List.of() : List.copyOf(plan.getToolPlan()))
                .build();
    }

    public AgentState withFetchResults(List<FetchResult> results) {
        if (!fetchResults.isEmpty()) {
            throw new IllegalStateException("Fetch results already recorded");
        }
        if (results.size() != toolPlan.size()) {
            throw new IllegalStateException(String.format(
                    "Expected %d fetch results, got %d", toolPlan.size(), results.size()));
        }
        return toBuilder().fetchResults(List.copyOf(results)).build();
    }

    public AgentState withErrors(List<ErrorRecord> errors) {
        if (errors.isEmpty()) return this;
        List<ErrorRecord> trace = new ArrayList<>(errorTrace);
        trace.addAll(errors);
        return toBuilder().errorTrace(List.copyOf(trace)).build();
    }

    public AgentState withError(ErrorRecord error) {
        return withErrors(List.of(error));
    }

    public AgentState withStage(Stage next) {
        if (!stage.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + stage + " -> " + next);
        }
        if (next == Stage.DONE) {
            throw new IllegalStateException("DONE is reached only through complete()");
        }
        return toBuilder().stage(next).build();
    }

    /** Sets the final response and moves to DONE in one step */
    public AgentState complete(String response) {
        if (response == null) {
            throw new IllegalArgumentException("Final response must not be null");
        }
        if (!stage.canTransitionTo(Stage.DONE)) {
            throw new IllegalStateException("Cannot complete from " + stage);
        }
        return toBuilder().finalResponse(response).stage(Stage.DONE).build();
    }

    public AgentState fail(ErrorRecord error) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Cannot fail a terminal turn in " + stage);
        }
        return withError(error).toBuilder()
                .stage(Stage.FAILED)
                .failure(error)
                .finalResponse(null)
                .build();
    }

    public AgentState cancel(String reason) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Cannot cancel a terminal turn in " + stage);
        }
        return withError(ErrorRecord.of(stage, ErrorKind.CANCELLED, reason)).toBuilder()
                .stage(Stage.CANCELLED)
                .finalResponse(null)
                .build();
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }
}
