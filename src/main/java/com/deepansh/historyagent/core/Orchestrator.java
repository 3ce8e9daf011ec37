package com.deepansh.historyagent.core;

import com.deepansh.historyagent.analyst.Analyst;
import com.deepansh.historyagent.core.StageHandler.StageOutcome;
import com.deepansh.historyagent.exception.GenerationUnavailableException;
import com.deepansh.historyagent.exception.TurnCancelledException;
import com.deepansh.historyagent.fetch.DataFetchExecutor;
import com.deepansh.historyagent.fetch.FetchOutcome;
import com.deepansh.historyagent.intent.IntentParser;
import com.deepansh.historyagent.model.AgentState;
import com.deepansh.historyagent.model.ErrorKind;
import com.deepansh.historyagent.model.ErrorRecord;
import com.deepansh.historyagent.model.Intent;
import com.deepansh.historyagent.model.IntentPlan;
import com.deepansh.historyagent.model.Stage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * Drives one conversation turn through the pipeline stages.
 *
 * Per-turn flow:
 * 1. INTENT_PARSING: classify the query and plan tool calls
 * 2. ROUTE: 'other' goes straight to analysis, everything else fetches data
 * 3. DATA_FETCHING: run the plan, one result per call
 * 4. ANALYZING: write the final response, then DONE
 *
 * Recoverable problems stay inside the state (fetch results, error trace).
 * An unavailable generation collaborator, or an unexpected error in a stage, ends the
 * turn in FAILED; a cancelled token ends it in CANCELLED. submit never throws for
 * either.
 */
@Service
@Slf4j
public class Orchestrator {

    public static final String GENERIC_FAILURE_MESSAGE =
            "Sorry, I'm temporarily unable to answer. Please try again in a moment.";

    private final IntentParser intentParser;
    private final DataFetchExecutor dataFetchExecutor;
    private final Analyst analyst;
    private final Map<Stage, StageHandler> handlers = new EnumMap<>(Stage.class);

    public Orchestrator(IntentParser intentParser, DataFetchExecutor dataFetchExecutor, Analyst analyst) {
        this.intentParser = intentParser;
        this.dataFetchExecutor = dataFetchExecutor;
        this.analyst = analyst;

        handlers.put(Stage.INTENT_PARSING, this::parseIntent);
        handlers.put(Stage.ROUTE, this::route);
        handlers.put(Stage.DATA_FETCHING, this::fetchData);
        handlers.put(Stage.ANALYZING, this::analyze);
    }

    public AgentState submit(AgentState prior, String userMessage) {
        return submit(prior, userMessage, new CancellationToken());
    }

    public AgentState submit(AgentState prior, String userMessage, CancellationToken token) {
        return run(AgentState.newTurn(prior, userMessage), token);
    }

    /** First turn of a conversation whose id the caller chose */
    public AgentState start(String conversationId, String userMessage, CancellationToken token) {
        return run(AgentState.start(conversationId, userMessage), token);
    }

    private AgentState run(AgentState state, CancellationToken token) {
        long started = System.currentTimeMillis();
        log.info("Agent turn started [conversationId={}, turn={}, input='{}']",
                state.getConversationId(), state.getHistory().size() + 1, state.getUserQuery());

        try {
            while (!state.isTerminal()) {
                token.throwIfCancelled();
                StageHandler handler = handlers.get(state.getStage());
                if (handler == null) {
                    throw new IllegalStateException("No handler for stage " + state.getStage());
                }

                StageOutcome outcome = handler.execute(state, token);
                token.throwIfCancelled();
                state = advance(state.getStage(), outcome);
            }
        } catch (TurnCancelledException e) {
            log.info("Agent turn cancelled [conversationId={}, stage={}]", state.getConversationId(), state.getStage());
            state = state.cancel(e.getMessage());
        } catch (GenerationUnavailableException e) {
            if (token.isCancelled()) {
                state = state.cancel("Turn was cancelled");
            } else {
                log.error("Generation unavailable [conversationId={}, stage={}]: {}",
                        state.getConversationId(), state.getStage(), e.getMessage());
                state = state.fail(ErrorRecord.of(state.getStage(), ErrorKind.GENERATION_UNAVAILABLE, e.getMessage()));
            }
        } catch (RuntimeException e) {
            log.error("Agent turn failed [conversationId={}, stage={}]", state.getConversationId(), state.getStage(), e);
            state = state.fail(ErrorRecord.of(state.getStage(), ErrorKind.INTERNAL, String.valueOf(e.getMessage())));
        }

        log.info("Agent turn complete [conversationId={}, stage={}, intent={}, tools={}, latency={}ms]",
                state.getConversationId(), state.getStage(),
                state.getIntent() == null ? null : state.getIntent().wireName(),
                state.getToolPlan().size(), System.currentTimeMillis() - started);
        return state;
    }

    private AgentState advance(Stage from, StageOutcome outcome) {
        Stage next = outcome.nextStage();
        if (!from.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition " + from + " -> " + next);
        }
        AgentState produced = outcome.state();
        return produced.getStage() == next ? produced : produced.withStage(next);
    }

    private StageOutcome parseIntent(AgentState state, CancellationToken token) {
        IntentPlan plan = intentParser.parse(state, token);
        AgentState next = state.withIntentPlan(plan);
        if (plan.isDegraded()) {
            next = next.withError(ErrorRecord.of(Stage.INTENT_PARSING, ErrorKind.PARSE_ERROR, plan.getReasoning()));
        }
        return new StageOutcome(Stage.ROUTE, next);
    }

    private StageOutcome route(AgentState state, CancellationToken token) {
        Stage next = state.getIntent() == Intent.OTHER ? Stage.ANALYZING : Stage.DATA_FETCHING;
        return new StageOutcome(next, state);
    }

    private StageOutcome fetchData(AgentState state, CancellationToken token) {
        FetchOutcome outcome = dataFetchExecutor.execute(state.getToolPlan(), state.getUserQuery(), token);
        return new StageOutcome(Stage.ANALYZING,
                state.withFetchResults(outcome.results()).withErrors(outcome.errors()));
    }

    private StageOutcome analyze(AgentState state, CancellationToken token) {
        return new StageOutcome(Stage.DONE, state.complete(analyst.analyze(state, token)));
    }
}
