package com.deepansh.historyagent.llm;

import com.deepansh.historyagent.exception.GenerationUnavailableException;
import com.deepansh.historyagent.exception.SchemaValidationException;
import com.deepansh.historyagent.exception.TransientGenerationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI-compatible generation client. Works with Groq, OpenAI, and Gemini.
 *
 * Structured calls use JSON mode with the schema embedded in the system prompt, then
 * validate the returned object locally; JSON mode is the one structured-output feature
 * all three providers share.
 *
 * Error handling strategy:
 *
 * | Error                  | Action                                              |
 * |------------------------|-----------------------------------------------------|
 * | 401 / 403              | GenerationUnavailableException (not retried)        |
 * | 429 rate limit         | TransientGenerationException (retried)              |
 * | 400 / other 4xx        | GenerationUnavailableException (not retried)        |
 * | 5xx server error       | TransientGenerationException (retried)              |
 * | network error          | TransientGenerationException (retried)              |
 * | invalid / non-conforming JSON | SchemaValidationException (caller decides)   |
 */
@Slf4j
public class OpenAiGenerationClient implements GenerationClient {

    private final ProviderSettings settings;
    private final ObjectMapper objectMapper;
    private final JsonSchemaValidator validator;
    private final String providerName;
    private final RestClient restClient;

    public OpenAiGenerationClient(ProviderSettings settings,
                                  ObjectMapper objectMapper,
                                  JsonSchemaValidator validator,
                                  RestClient.Builder restClientBuilder) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.validator = validator;
        this.providerName = settings.getName();
        this.restClient = restClientBuilder
                .baseUrl(settings.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + settings.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public JsonNode generateStructured(OutputSchema schema, String prompt, String context) {
        String schemaJson;
        try {
            schemaJson = objectMapper.writeValueAsString(schema.getJsonSchema());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Schema " + schema.getName() + " is not serializable", e);
        }

        String systemPrompt = prompt + """


                Respond with ONLY a JSON object. No explanation, no markdown, no prose.
                The object must conform to this JSON Schema (%s):
                %s
                """.formatted(schema.getName(), schemaJson);

        Map<String, Object> body = requestBody(settings.getStructuredModel(), systemPrompt, context, 0.0);
        body.put("response_format", Map.of("type", "json_object"));

        String raw = complete(body);
        JsonNode value = parseJson(raw, schema.getName());

        List<String> violations = validator.validate(value, schema.getJsonSchema());
        if (!violations.isEmpty()) {
            log.warn("{} output for schema [{}] failed validation: {}", providerName, schema.getName(), violations);
            throw new SchemaValidationException("Output does not match schema " + schema.getName(), violations);
        }
        return value;
    }

    @Override
    public String generateText(String personaPrompt, String context) {
        Map<String, Object> body = requestBody(settings.getSynthesisModel(), personaPrompt, context, settings.getTemperature());
        String text = complete(body);
        if (text == null || text.isBlank()) {
            throw new TransientGenerationException(providerName + " returned an empty completion");
        }
        return text.strip();
    }

    private Map<String, Object> requestBody(String model, String system, String user, double temperature) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("max_tokens", settings.getMaxTokens());
        body.put("temperature", temperature);
        body.put("messages", List.of(
                Map.of("role", "system", "content", system),
                Map.of("role", "user", "content", user != null ? user : "")));
        return body;
    }

    private String complete(Map<String, Object> requestBody) {
        log.debug("Sending completion to {} [model={}]", providerName, requestBody.get("model"));

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", providerName, res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", providerName, res.getStatusCode(), body);
                        throw new TransientGenerationException(
                                providerName + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ResourceAccessException e) {
            throw new TransientGenerationException(providerName + " unreachable: " + e.getMessage(), e);
        }

        return extractContent(response);
    }

    private void handle4xxError(String body, int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            throw new GenerationUnavailableException(
                    providerName + " API key is invalid. Check your " +
                    providerName.toUpperCase() + "_API_KEY environment variable.");
        }

        if (statusCode == 429) {
            throw new TransientGenerationException(providerName + " rate limit exceeded. Will retry.");
        }

        if (body.contains("model_decommissioned") || body.contains("model_not_found")) {
            throw new GenerationUnavailableException(
                    "Model is not available on " + providerName + ". Update agent.model-identifier-* or the provider model.");
        }

        throw new GenerationUnavailableException(providerName + " client error [" + statusCode + "]: " + body);
    }

    @SuppressWarnings("unchecked")
    private String extractContent(Map<String, Object> response) {
        List<Map<String, Object>> choices = response == null ? null : (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new TransientGenerationException(providerName + " returned no choices in response");
        }

        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            log.debug("Token usage: prompt={} completion={}",
                    usage.getOrDefault("prompt_tokens", 0), usage.getOrDefault("completion_tokens", 0));
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        return message == null ? null : (String) message.get("content");
    }

    private JsonNode parseJson(String raw, String schemaName) {
        if (raw == null || raw.isBlank()) {
            throw new SchemaValidationException("Empty response for schema " + schemaName);
        }

        // Strip markdown fences some models add even in JSON mode
        String cleaned = raw.strip()
                .replaceAll("(?s)^```json\\s*", "")
                .replaceAll("(?s)^```\\s*", "")
                .replaceAll("(?s)```\\s*$", "")
                .strip();

        try {
            return objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.warn("Response for schema [{}] is not valid JSON. First 100 chars: '{}'",
                    schemaName, cleaned.substring(0, Math.min(100, cleaned.length())));
            throw new SchemaValidationException("Response is not valid JSON for schema " + schemaName, e);
        }
    }
}
