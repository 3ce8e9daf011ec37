package com.deepansh.historyagent.intent;

import com.deepansh.historyagent.config.AgentProperties;
import com.deepansh.historyagent.core.CancellationToken;
import com.deepansh.historyagent.exception.GenerationUnavailableException;
import com.deepansh.historyagent.exception.SchemaValidationException;
import com.deepansh.historyagent.llm.GenerationClient;
import com.deepansh.historyagent.llm.OutputSchema;
import com.deepansh.historyagent.model.AgentState;
import com.deepansh.historyagent.model.ConversationTurn;
import com.deepansh.historyagent.model.Intent;
import com.deepansh.historyagent.model.IntentPlan;
import com.deepansh.historyagent.model.ToolCall;
import com.deepansh.historyagent.resilience.PolicyExecutor;
import com.deepansh.historyagent.tool.ToolDefinition;
import com.deepansh.historyagent.tool.ToolRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Classifies a user query into an {@link Intent} and proposes the ordered tool plan.
 *
 * Each attempt is one structured-generation call followed by plan validation; invalid
 * output and timeouts are retried with the same input. Once any attempt got an answer
 * back, running out of attempts degrades the plan to OTHER instead of failing the turn.
 * Only a collaborator that never answered (every attempt timed out or was unavailable)
 * is fatal.
 */
@Component
@Slf4j
public class IntentParser {

    static final String SCHEMA_NAME = "intent_plan";
    static final int HISTORY_TURNS_IN_CONTEXT = 5;

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final GenerationClient generationClient;
    private final ToolRegistry toolRegistry;
    private final PolicyExecutor policyExecutor;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final OutputSchema schema;

    public IntentParser(GenerationClient generationClient,
                        ToolRegistry toolRegistry,
                        PolicyExecutor policyExecutor,
                        AgentProperties properties,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this.generationClient = generationClient;
        this.toolRegistry = toolRegistry;
        this.policyExecutor = policyExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.schema = buildSchema();
    }

    public IntentPlan parse(AgentState state, CancellationToken token) {
        String prompt = buildPrompt();
        String context = buildContext(state);
        AtomicBoolean answered = new AtomicBoolean();

        try {
            IntentPlan plan = policyExecutor.execute(
                    properties.intentParsePolicy(),
                    () -> attempt(prompt, context, answered),
                    ex -> ex instanceof SchemaValidationException || ex instanceof TimeoutException,
                    token);
            log.info("Intent parsed [conversationId={}, intent={}, tools={}]",
                    state.getConversationId(), plan.getIntent().wireName(),
                    plan.getToolPlan().stream().map(ToolCall::getName).toList());
            return plan;
        } catch (SchemaValidationException e) {
            return degrade(state, e.getMessage());
        } catch (TimeoutException e) {
            if (answered.get()) {
                return degrade(state, "invalid output, then the last attempt timed out");
            }
            throw new GenerationUnavailableException("Intent parsing timed out on every attempt", e);
        } catch (GenerationUnavailableException e) {
            if (answered.get()) {
                return degrade(state, "invalid output, then generation became unavailable: " + e.getMessage());
            }
            throw e;
        }
    }

    private IntentPlan attempt(String prompt, String context, AtomicBoolean answered) {
        JsonNode output;
        try {
            output = generationClient.generateStructured(schema, prompt, context);
        } catch (SchemaValidationException e) {
            answered.set(true);
            throw e;
        }
        answered.set(true);
        return toPlan(output);
    }

    private IntentPlan degrade(AgentState state, String reason) {
        log.warn("Intent parsing failed, degrading to 'other' [conversationId={}]: {}",
                state.getConversationId(), reason);
        return IntentPlan.degraded("Intent parsing failed: " + reason);
    }

    /** Validates generated output against the registry; any problem is a parse error */
    IntentPlan toPlan(JsonNode output) {
        String intentName = output.path("intent_type").asText(null);
        Intent intent = Intent.fromWireName(intentName)
                .orElseThrow(() -> new SchemaValidationException("Unknown intent_type: " + intentName));

        List<ToolCall> toolPlan = new ArrayList<>();
        for (JsonNode entry : output.path("tool_plan")) {
            String toolName = entry.path("tool_name").asText(null);
            if (!toolRegistry.hasTool(toolName)) {
                throw new SchemaValidationException("Planned tool is not registered: " + toolName);
            }
            JsonNode args = entry.path("arguments");
            Map<String, Object> rawArgs = args.isObject()
                    ? objectMapper.convertValue(args, ARGS_TYPE)
                    : Map.of();
            toolPlan.add(ToolCall.of(toolName, rawArgs, entry.path("reasoning").asText(null)));
        }

        if (intent == Intent.OTHER && !toolPlan.isEmpty()) {
            log.debug("Dropping {} planned tool(s) for intent 'other'", toolPlan.size());
            toolPlan.clear();
        }
        if (intent != Intent.OTHER && toolPlan.isEmpty()) {
            throw new SchemaValidationException("Intent " + intent.wireName() + " requires at least one tool");
        }

        return IntentPlan.builder()
                .intent(intent)
                .toolPlan(List.copyOf(toolPlan))
                .reasoning(output.path("reasoning").asText(null))
                .analysisFocus(output.path("analysis_focus").asText(null))
                .build();
    }

    private OutputSchema buildSchema() {
        Map<String, Object> step = Map.of(
                "type", "object",
                "properties", Map.of(
                        "tool_name", Map.of("type", "string", "enum", List.copyOf(toolRegistry.toolNames())),
                        "arguments", Map.of("type", "object"),
                        "reasoning", Map.of("type", "string")),
                "required", List.of("tool_name"));

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("intent_type", Map.of(
                "type", "string",
                "enum", Arrays.stream(Intent.values()).map(Intent::wireName).toList()));
        properties.put("reasoning", Map.of("type", "string"));
        properties.put("analysis_focus", Map.of("type", "string"));
        properties.put("tool_plan", Map.of("type", "array", "items", step));

        return OutputSchema.of(SCHEMA_NAME,
                "Classified intent and ordered tool plan for one user request",
                Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", List.of("intent_type", "reasoning", "tool_plan"),
                        "additionalProperties", false));
    }

    private String buildPrompt() {
        return """
                You are the orchestrator of a listening-history assistant.
                Your job is to:
                1. Understand the user's request.
                2. Select the tools from the catalog below that fetch the data needed to answer it.
                3. Classify the user's intent to guide the downstream analyst.

                ### Available Tools:
                %s

                ### Tool Selection Guidelines:
                - Prefer the most specific tool; use several tools when the question needs several facts.
                - For recommendations you usually need top artists and top tracks as a baseline.
                - Give each tool's arguments. For dates either set start_date / end_date (YYYY-MM-DD)
                  or set "time_range" to a phrase such as "last year", "this month", "last 30 days"
                  or "all time".

                ### Intent Classification Guidelines:
                - factual_query: the user wants raw numbers, lists or specific facts.
                - insight_analysis: the user asks about habits, trends, comparisons, "why" or "how".
                - recommendation: the user explicitly asks for new music suggestions.
                - other: greetings or questions unrelated to the listening data; tool_plan must be empty.
                For insight_analysis, set analysis_focus to what the analysis should concentrate on.

                Current date: %s
                """.formatted(toolCatalog(), LocalDate.now(clock));
    }

    private String toolCatalog() {
        ObjectWriter writer = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        StringBuilder sb = new StringBuilder();
        for (ToolDefinition def : toolRegistry.getAllDefinitions()) {
            sb.append("- **").append(def.getName()).append("**: ")
                    .append(def.getDescription().replaceAll("\\s+", " ")).append('\n');
            try {
                sb.append("  parameters: ").append(writer.writeValueAsString(def.getParameterSchema())).append('\n');
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Parameter schema of " + def.getName() + " is not serializable", e);
            }
        }
        return sb.toString().strip();
    }

    private String buildContext(AgentState state) {
        StringBuilder sb = new StringBuilder();
        List<ConversationTurn> history = state.getHistory();
        List<ConversationTurn> recent = history.subList(
                Math.max(0, history.size() - HISTORY_TURNS_IN_CONTEXT), history.size());
        if (!recent.isEmpty()) {
            sb.append("Conversation so far:\n");
            for (ConversationTurn turn : recent) {
                sb.append("User: ").append(turn.getUserQuery()).append('\n');
                sb.append("Assistant: ").append(turn.getResponse()).append('\n');
            }
            sb.append('\n');
        }
        sb.append("Current request: ").append(state.getUserQuery());
        return sb.toString();
    }
}
