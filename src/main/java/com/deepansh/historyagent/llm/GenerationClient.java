package com.deepansh.historyagent.llm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Every language-model interaction the agent needs, reduced to two operations.
 *
 * Implementations throw
 * {@link com.deepansh.historyagent.exception.SchemaValidationException} when a structured
 * result does not conform to the schema, and
 * {@link com.deepansh.historyagent.exception.GenerationUnavailableException} when the
 * model cannot be reached at all.
 */
public interface GenerationClient {

    /**
     * Produce a value conforming to {@code schema}.
     *
     * @param schema  JSON Schema the result must satisfy
     * @param prompt  instructions (sent as the system message)
     * @param context the material to work on (sent as the user message)
     * @return the validated value
     */
    JsonNode generateStructured(OutputSchema schema, String prompt, String context);

    /**
     * Produce free text in the voice described by {@code personaPrompt}.
     */
    String generateText(String personaPrompt, String context);
}
