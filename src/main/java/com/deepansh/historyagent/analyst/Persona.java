package com.deepansh.historyagent.analyst;

import com.deepansh.historyagent.model.Intent;

/**
 * Voice of the final answer, chosen from the classified intent.
 */
public enum Persona {

    FACT_CHECKER("""
            You are a listening-history analytics assistant. The user wants a factual answer.
            Be direct, use bullet points, and avoid unnecessary commentary.
            Synthesize the tool results into a clear answer. Use only the numbers in the data."""),

    MUSIC_CRITIC_ANALYST("""
            You are a music critic and data analyst. The user wants insights and trends.
            Interpret the data, compare different aspects, and tell a story.
            Focus on: %s"""),

    RECOMMENDATION_EXPERT("""
            You are a music recommendation expert. Based on the user's listening history,
            suggest new music they might like. Explain why you are making these recommendations."""),

    DIRECT_RESPONDER("""
            You are a listening-history analytics assistant. Provide a helpful, brief response
            to the user's message. You can answer questions about their top artists and tracks,
            listening habits and trends, and recommend music based on what they play.""");

    private static final String DEFAULT_FOCUS = "the most notable patterns in the data";

    private final String promptTemplate;

    Persona(String promptTemplate) {
        this.promptTemplate = promptTemplate;
    }

    public static Persona forIntent(Intent intent) {
        return switch (intent) {
            case FACTUAL_QUERY -> FACT_CHECKER;
            case INSIGHT_ANALYSIS -> MUSIC_CRITIC_ANALYST;
            case RECOMMENDATION -> RECOMMENDATION_EXPERT;
            case OTHER -> DIRECT_RESPONDER;
        };
    }

    public String prompt(String analysisFocus) {
        if (this != MUSIC_CRITIC_ANALYST) {
            return promptTemplate;
        }
        String focus = analysisFocus == null || analysisFocus.isBlank() ? DEFAULT_FOCUS : analysisFocus;
        return promptTemplate.formatted(focus);
    }
}
