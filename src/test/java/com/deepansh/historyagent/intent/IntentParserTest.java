package com.deepansh.historyagent.intent;

import com.deepansh.historyagent.TestFixtures;
import com.deepansh.historyagent.config.AgentProperties;
import com.deepansh.historyagent.core.CancellationToken;
import com.deepansh.historyagent.exception.GenerationUnavailableException;
import com.deepansh.historyagent.exception.SchemaValidationException;
import com.deepansh.historyagent.history.ListeningHistoryQueryService;
import com.deepansh.historyagent.llm.GenerationClient;
import com.deepansh.historyagent.llm.JsonSchemaValidator;
import com.deepansh.historyagent.llm.OutputSchema;
import com.deepansh.historyagent.model.AgentState;
import com.deepansh.historyagent.model.ConversationTurn;
import com.deepansh.historyagent.model.Intent;
import com.deepansh.historyagent.model.IntentPlan;
import com.deepansh.historyagent.model.ToolCall;
import com.deepansh.historyagent.resilience.PolicyExecutor;
import com.deepansh.historyagent.tool.ToolRegistry;
import com.deepansh.historyagent.tool.impl.ListeningTrendTool;
import com.deepansh.historyagent.tool.impl.SummaryStatsTool;
import com.deepansh.historyagent.tool.impl.TopEntitiesTool;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntentParserTest {

    private static final String FACTUAL = """
            {"intent_type": "factual_query",
             "reasoning": "Rank artists for last year",
             "tool_plan": [{"tool_name": "top_n_entities",
                            "arguments": {"entity": "artist", "n": 5, "time_range": "last year"},
                            "reasoning": "top artists"}]}
            """;

    private final ObjectMapper mapper = TestFixtures.objectMapper();
    private ExecutorService pool;
    private GenerationClient generationClient;
    private IntentParser parser;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        ListeningHistoryQueryService history = mock(ListeningHistoryQueryService.class);
        ToolRegistry registry = new ToolRegistry(
                List.of(new SummaryStatsTool(history), new TopEntitiesTool(history), new ListeningTrendTool(history)),
                new JsonSchemaValidator(), mapper);
        generationClient = mock(GenerationClient.class);
        parser = new IntentParser(generationClient, registry, new PolicyExecutor(pool),
                TestFixtures.fastProperties(), mapper, TestFixtures.CLOCK);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    private AgentState turn(String query) {
        return AgentState.newTurn(null, query);
    }

    @Test
    void parse_validPlan_returnsIntentAndToolCalls() throws Exception {
        when(generationClient.generateStructured(any(), anyString(), anyString())).thenReturn(json(FACTUAL));

        IntentPlan plan = parser.parse(turn("Who were my top 5 artists last year?"), new CancellationToken());

        assertThat(plan.getIntent()).isEqualTo(Intent.FACTUAL_QUERY);
        assertThat(plan.isDegraded()).isFalse();
        assertThat(plan.getReasoning()).isEqualTo("Rank artists for last year");
        assertThat(plan.getToolPlan()).singleElement().satisfies(call -> {
            assertThat(call.getName()).isEqualTo("top_n_entities");
            assertThat(call.getRawArgsSpec()).containsEntry("time_range", "last year").containsEntry("n", 5);
            assertThat(call.getReasoning()).isEqualTo("top artists");
        });
    }

    @Test
    void parse_invalidThenValid_retriesWithSameInput() throws Exception {
        when(generationClient.generateStructured(any(), anyString(), anyString()))
                .thenThrow(new SchemaValidationException("not json"))
                .thenReturn(json(FACTUAL));

        IntentPlan plan = parser.parse(turn("top artists"), new CancellationToken());

        assertThat(plan.getIntent()).isEqualTo(Intent.FACTUAL_QUERY);
        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> contexts = ArgumentCaptor.forClass(String.class);
        verify(generationClient, times(2)).generateStructured(any(), prompts.capture(), contexts.capture());
        assertThat(prompts.getAllValues().get(0)).isEqualTo(prompts.getAllValues().get(1));
        assertThat(contexts.getAllValues().get(0)).isEqualTo(contexts.getAllValues().get(1));
    }

    @Test
    void parse_unknownToolOnEveryAttempt_degradesToOther() throws Exception {
        when(generationClient.generateStructured(any(), anyString(), anyString())).thenReturn(json("""
                {"intent_type": "factual_query", "reasoning": "r",
                 "tool_plan": [{"tool_name": "get_top_artists"}]}
                """));

        IntentPlan plan = parser.parse(turn("top artists"), new CancellationToken());

        assertThat(plan.getIntent()).isEqualTo(Intent.OTHER);
        assertThat(plan.isDegraded()).isTrue();
        assertThat(plan.getToolPlan()).isEmpty();
        assertThat(plan.getReasoning()).contains("get_top_artists");
        // max-intent-parse-retries = 2, so three attempts in total
        verify(generationClient, times(3)).generateStructured(any(), anyString(), anyString());
    }

    @Test
    void parse_nonOtherIntentWithoutTools_isParseError() throws Exception {
        when(generationClient.generateStructured(any(), anyString(), anyString())).thenReturn(json("""
                {"intent_type": "insight_analysis", "reasoning": "r", "tool_plan": []}
                """));

        IntentPlan plan = parser.parse(turn("how did my taste change"), new CancellationToken());

        assertThat(plan.isDegraded()).isTrue();
        verify(generationClient, times(3)).generateStructured(any(), anyString(), anyString());
    }

    @Test
    void parse_otherWithTools_normalizedToEmptyPlan() throws Exception {
        when(generationClient.generateStructured(any(), anyString(), anyString())).thenReturn(json("""
                {"intent_type": "other", "reasoning": "Greeting",
                 "tool_plan": [{"tool_name": "summary_stats"}]}
                """));

        IntentPlan plan = parser.parse(turn("hello!"), new CancellationToken());

        assertThat(plan.getIntent()).isEqualTo(Intent.OTHER);
        assertThat(plan.isDegraded()).isFalse();
        assertThat(plan.getToolPlan()).isEmpty();
    }

    private IntentParser parserWithGenerationTimeout(Duration timeout) {
        AgentProperties properties = TestFixtures.fastProperties();
        properties.setGenerationTimeout(timeout);
        ToolRegistry registry = new ToolRegistry(
                List.of(new SummaryStatsTool(mock(ListeningHistoryQueryService.class))),
                new JsonSchemaValidator(), mapper);
        return new IntentParser(generationClient, registry, new PolicyExecutor(pool),
                properties, mapper, TestFixtures.CLOCK);
    }

    @Test
    void parse_invalidOutputThenTimeout_degradesInsteadOfFailing() {
        IntentParser slowParser = parserWithGenerationTimeout(Duration.ofMillis(200));
        when(generationClient.generateStructured(any(), anyString(), anyString()))
                .thenThrow(new SchemaValidationException("not json"))
                .thenThrow(new SchemaValidationException("still not json"))
                .thenAnswer(inv -> {
                    Thread.sleep(5_000);
                    return json(FACTUAL);
                });

        IntentPlan plan = slowParser.parse(turn("top artists"), new CancellationToken());

        assertThat(plan.getIntent()).isEqualTo(Intent.OTHER);
        assertThat(plan.isDegraded()).isTrue();
        verify(generationClient, times(3)).generateStructured(any(), anyString(), anyString());
    }

    @Test
    void parse_invalidOutputThenUnavailable_degrades() {
        when(generationClient.generateStructured(any(), anyString(), anyString()))
                .thenThrow(new SchemaValidationException("not json"))
                .thenThrow(new GenerationUnavailableException("circuit open"));

        IntentPlan plan = parser.parse(turn("top artists"), new CancellationToken());

        assertThat(plan.isDegraded()).isTrue();
        assertThat(plan.getReasoning()).contains("circuit open");
    }

    @Test
    void parse_timeoutOnEveryAttempt_isUnavailable() {
        IntentParser slowParser = parserWithGenerationTimeout(Duration.ofMillis(100));
        when(generationClient.generateStructured(any(), anyString(), anyString())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return json(FACTUAL);
        });

        assertThatThrownBy(() -> slowParser.parse(turn("top artists"), new CancellationToken()))
                .isInstanceOf(GenerationUnavailableException.class);
        verify(generationClient, times(3)).generateStructured(any(), anyString(), anyString());
    }

    @Test
    void parse_generationUnavailable_propagatesWithoutRetry() {
        when(generationClient.generateStructured(any(), anyString(), anyString()))
                .thenThrow(new GenerationUnavailableException("circuit open"));

        assertThatThrownBy(() -> parser.parse(turn("top artists"), new CancellationToken()))
                .isInstanceOf(GenerationUnavailableException.class);
        verify(generationClient, times(1)).generateStructured(any(), anyString(), anyString());
    }

    @Test
    void parse_promptCarriesCatalogDateAndHistory() throws Exception {
        when(generationClient.generateStructured(any(), anyString(), anyString())).thenReturn(json(FACTUAL));
        AgentState state = AgentState.builder()
                .conversationId("c-1")
                .history(List.of(new ConversationTurn("Top artist in 2024?", "Bjork.")))
                .userQuery("And last year?")
                .build();

        parser.parse(state, new CancellationToken());

        ArgumentCaptor<OutputSchema> schema = ArgumentCaptor.forClass(OutputSchema.class);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);
        verify(generationClient).generateStructured(schema.capture(), prompt.capture(), context.capture());

        assertThat(schema.getValue().getName()).isEqualTo("intent_plan");
        assertThat(prompt.getValue())
                .contains("**listening_trend**", "**summary_stats**", "**top_n_entities**")
                .contains("Current date: 2026-01-05");
        assertThat(context.getValue())
                .contains("User: Top artist in 2024?")
                .contains("Assistant: Bjork.")
                .endsWith("Current request: And last year?");
    }

    @Test
    void toPlan_sameOutput_samePlan() throws Exception {
        IntentPlan first = parser.toPlan(json(FACTUAL));
        IntentPlan second = parser.toPlan(json(FACTUAL));

        assertThat(first).isEqualTo(second);
        assertThat(first.getToolPlan()).extracting(ToolCall::getName).containsExactly("top_n_entities");
    }
}
