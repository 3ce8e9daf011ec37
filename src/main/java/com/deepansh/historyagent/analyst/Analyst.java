package com.deepansh.historyagent.analyst;

import com.deepansh.historyagent.config.AgentProperties;
import com.deepansh.historyagent.core.CancellationToken;
import com.deepansh.historyagent.exception.GenerationUnavailableException;
import com.deepansh.historyagent.llm.GenerationClient;
import com.deepansh.historyagent.model.AgentState;
import com.deepansh.historyagent.model.ConversationTurn;
import com.deepansh.historyagent.model.FetchResult;
import com.deepansh.historyagent.model.Intent;
import com.deepansh.historyagent.resilience.PolicyExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Writes the final response from the intent and the fetched results.
 *
 * Rules:
 * - a degraded 'other' intent gets a fixed fallback, no generation call
 * - 'other' is answered directly by the DirectResponder persona
 * - when no call returned data, a fixed limitation message lists what failed;
 *   nothing is generated, so no numbers can be invented
 * - otherwise the persona sees only successful payloads, and notes about missing or
 *   truncated data are appended to its text
 */
@Component
@Slf4j
public class Analyst {

    static final String DEGRADED_FALLBACK =
            "I'm sorry, I couldn't work out what you were asking. I can answer questions about your "
            + "listening history, such as your top artists and tracks, your listening habits over time, "
            + "or music recommendations based on what you play.";

    static final String TRUNCATION_NOTE =
            "Note: some results were truncated, so this answer may be incomplete.";

    private static final int HISTORY_TURNS_IN_CONTEXT = 3;

    private final GenerationClient generationClient;
    private final PolicyExecutor policyExecutor;
    private final AgentProperties properties;

    public Analyst(GenerationClient generationClient, PolicyExecutor policyExecutor, AgentProperties properties) {
        this.generationClient = generationClient;
        this.policyExecutor = policyExecutor;
        this.properties = properties;
    }

    public String analyze(AgentState state, CancellationToken token) {
        Intent intent = state.getIntent();
        Persona persona = Persona.forIntent(intent);
        List<FetchResult> results = state.getFetchResults();

        if (intent == Intent.OTHER) {
            if (state.isIntentDegraded()) {
                log.info("Degraded intent, returning fallback [conversationId={}]", state.getConversationId());
                return DEGRADED_FALLBACK;
            }
            return generate(persona.prompt(null), directContext(state), token);
        }

        List<FetchResult> ok = results.stream().filter(FetchResult::isOk).toList();
        List<FetchResult> missing = results.stream().filter(r -> !r.isOk()).toList();

        if (ok.isEmpty()) {
            log.warn("No tool returned data, answering with limitation message [conversationId={}]",
                    state.getConversationId());
            return limitationMessage(missing);
        }

        log.info("Synthesizing response [conversationId={}, persona={}, ok={}, missing={}]",
                state.getConversationId(), persona, ok.size(), missing.size());

        String text = generate(persona.prompt(state.getAnalysisFocus()), dataContext(state, ok, missing), token);

        StringBuilder response = new StringBuilder(text);
        if (!missing.isEmpty()) {
            response.append("\n\n").append(partialDataNote(missing));
        }
        if (ok.stream().anyMatch(FetchResult::isTruncated)) {
            response.append("\n\n").append(TRUNCATION_NOTE);
        }
        return response.toString();
    }

    private String generate(String prompt, String context, CancellationToken token) {
        try {
            return policyExecutor.execute(
                    properties.singleGenerationPolicy("synthesis"),
                    () -> generationClient.generateText(prompt, context),
                    ex -> false,
                    token);
        } catch (TimeoutException e) {
            throw new GenerationUnavailableException("Response synthesis timed out", e);
        }
    }

    static String limitationMessage(List<FetchResult> missing) {
        StringBuilder sb = new StringBuilder(
                "I wasn't able to retrieve the listening data needed to answer this, so I can't give you a reliable answer:\n");
        for (FetchResult r : missing) {
            sb.append("- ").append(r.getToolName()).append(": ").append(r.getStatus().wireName()).append('\n');
        }
        sb.append("Please try again in a moment.");
        return sb.toString();
    }

    static String partialDataNote(List<FetchResult> missing) {
        return "Note: this answer is based on partial data. I could not retrieve: "
                + String.join(", ", missing.stream().map(FetchResult::getToolName).toList()) + ".";
    }

    private String directContext(AgentState state) {
        StringBuilder sb = new StringBuilder();
        appendHistory(sb, state.getHistory());
        sb.append("Please address my request: ").append(state.getUserQuery());
        return sb.toString();
    }

    private String dataContext(AgentState state, List<FetchResult> ok, List<FetchResult> missing) {
        StringBuilder sb = new StringBuilder();
        appendHistory(sb, state.getHistory());
        sb.append("Here is the retrieved listening data for analysis:\n<data>\n");
        for (FetchResult r : ok) {
            sb.append("### Tool: ").append(r.getToolName()).append('\n');
            Map<String, Object> args = r.getResolvedArguments();
            if (!args.isEmpty()) {
                sb.append("Arguments: ").append(args).append('\n');
            }
            sb.append(r.getPayload()).append("\n\n");
        }
        sb.append("</data>\n");
        if (!missing.isEmpty()) {
            sb.append("Unavailable (do not guess these): ");
            sb.append(String.join(", ", missing.stream()
                    .map(r -> r.getToolName() + " (" + r.getStatus().wireName() + ")").toList()));
            sb.append('\n');
        }
        sb.append("Based on the data above, please address my original request: ").append(state.getUserQuery());
        return sb.toString();
    }

    private void appendHistory(StringBuilder sb, List<ConversationTurn> history) {
        List<ConversationTurn> recent = history.subList(
                Math.max(0, history.size() - HISTORY_TURNS_IN_CONTEXT), history.size());
        if (recent.isEmpty()) return;
        sb.append("Earlier in this conversation:\n");
        for (ConversationTurn turn : recent) {
            sb.append("User: ").append(turn.getUserQuery()).append('\n');
            sb.append("Assistant: ").append(turn.getResponse()).append('\n');
        }
        sb.append('\n');
    }
}
