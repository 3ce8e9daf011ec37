package com.deepansh.historyagent.core;

import com.deepansh.historyagent.analyst.Analyst;
import com.deepansh.historyagent.exception.GenerationUnavailableException;
import com.deepansh.historyagent.exception.TurnCancelledException;
import com.deepansh.historyagent.fetch.DataFetchExecutor;
import com.deepansh.historyagent.fetch.FetchOutcome;
import com.deepansh.historyagent.intent.IntentParser;
import com.deepansh.historyagent.model.AgentResponse;
import com.deepansh.historyagent.model.AgentState;
import com.deepansh.historyagent.model.ErrorKind;
import com.deepansh.historyagent.model.ErrorRecord;
import com.deepansh.historyagent.model.FetchResult;
import com.deepansh.historyagent.model.FetchStatus;
import com.deepansh.historyagent.model.Intent;
import com.deepansh.historyagent.model.IntentPlan;
import com.deepansh.historyagent.model.Stage;
import com.deepansh.historyagent.model.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrchestratorTest {

    @Mock private IntentParser intentParser;
    @Mock private DataFetchExecutor dataFetchExecutor;
    @Mock private Analyst analyst;

    private Orchestrator orchestrator;

    private static final ToolCall TOP_ARTISTS_CALL =
            ToolCall.of("top_n_entities", Map.of("entity", "artist", "n", 5, "time_range", "last year"));
    private static final ToolCall TREND_CALL =
            ToolCall.of("listening_trend", Map.of("bucket", "month"));

    @BeforeEach
    void setUp() {
        orchestrator = new Orchestrator(intentParser, dataFetchExecutor, analyst);
    }

    private static IntentPlan plan(Intent intent, ToolCall... calls) {
        return IntentPlan.builder().intent(intent).toolPlan(List.of(calls)).reasoning("test").build();
    }

    private static FetchResult ok(String tool) {
        return FetchResult.ok(tool, "[{\"plays\":1}]", false, 1, Map.of());
    }

    @Test
    void submit_factualQuery_runsEveryStageToDone() {
        when(intentParser.parse(any(), any())).thenReturn(plan(Intent.FACTUAL_QUERY, TOP_ARTISTS_CALL));
        when(dataFetchExecutor.execute(anyList(), anyString(), any()))
                .thenReturn(new FetchOutcome(List.of(ok("top_n_entities")), List.of()));
        when(analyst.analyze(any(), any())).thenReturn("Your top artist was Bjork.");

        AgentState state = orchestrator.submit(null, "Who were my top artists last year?");

        assertThat(state.getStage()).isEqualTo(Stage.DONE);
        assertThat(state.getIntent()).isEqualTo(Intent.FACTUAL_QUERY);
        assertThat(state.getFinalResponse()).isEqualTo("Your top artist was Bjork.");
        assertThat(state.getFetchResults()).hasSameSizeAs(state.getToolPlan());
        assertThat(state.getErrorTrace()).isEmpty();
        assertThat(state.getConversationId()).isNotBlank();
        verify(dataFetchExecutor).execute(eq(List.of(TOP_ARTISTS_CALL)), eq("Who were my top artists last year?"),
                any(CancellationToken.class));
    }

    @Test
    void submit_otherIntent_skipsDataFetching() {
        when(intentParser.parse(any(), any())).thenReturn(plan(Intent.OTHER));
        when(analyst.analyze(any(), any())).thenReturn("Hello! Ask me about your music.");

        AgentState state = orchestrator.submit(null, "hi");

        assertThat(state.getStage()).isEqualTo(Stage.DONE);
        assertThat(state.getToolPlan()).isEmpty();
        assertThat(state.getFetchResults()).isEmpty();
        verifyNoInteractions(dataFetchExecutor);
    }

    @Test
    void submit_degradedPlan_recordsParseErrorAndStillCompletes() {
        when(intentParser.parse(any(), any())).thenReturn(IntentPlan.degraded("Intent parsing failed: bad output"));
        when(analyst.analyze(any(), any())).thenReturn("I couldn't work out what you were asking.");

        AgentState state = orchestrator.submit(null, "asdf qwer");

        assertThat(state.getStage()).isEqualTo(Stage.DONE);
        assertThat(state.getIntent()).isEqualTo(Intent.OTHER);
        assertThat(state.isIntentDegraded()).isTrue();
        assertThat(state.getErrorTrace()).extracting(ErrorRecord::getKind).containsExactly(ErrorKind.PARSE_ERROR);
        verifyNoInteractions(dataFetchExecutor);
    }

    @Test
    void submit_partialFetchFailure_keepsOneResultPerCallAndCompletes() {
        FetchResult failed = FetchResult.failed("listening_trend", "store offline", 3, Map.of());
        ErrorRecord error = ErrorRecord.forTool(Stage.DATA_FETCHING, ErrorKind.TOOL_EXECUTION_ERROR,
                "listening_trend", "store offline");
        when(intentParser.parse(any(), any()))
                .thenReturn(plan(Intent.INSIGHT_ANALYSIS, TOP_ARTISTS_CALL, TREND_CALL));
        when(dataFetchExecutor.execute(anyList(), anyString(), any()))
                .thenReturn(new FetchOutcome(List.of(ok("top_n_entities"), failed), List.of(error)));
        when(analyst.analyze(any(), any())).thenReturn("Partial answer.");

        AgentState state = orchestrator.submit(null, "How has my taste changed?");

        assertThat(state.getStage()).isEqualTo(Stage.DONE);
        assertThat(state.getFetchResults()).extracting(FetchResult::getStatus)
                .containsExactly(FetchStatus.OK, FetchStatus.FAILED);
        assertThat(state.getErrorTrace()).containsExactly(error);
    }

    @Test
    void submit_generationUnavailable_failsWithGenericMessage() {
        when(intentParser.parse(any(), any())).thenThrow(new GenerationUnavailableException("provider down"));

        AgentState state = orchestrator.submit(null, "Who were my top artists?");

        assertThat(state.getStage()).isEqualTo(Stage.FAILED);
        assertThat(state.getFinalResponse()).isNull();
        assertThat(state.getFailure().getKind()).isEqualTo(ErrorKind.GENERATION_UNAVAILABLE);
        assertThat(state.getFailure().getStage()).isEqualTo(Stage.INTENT_PARSING);

        AgentResponse response = AgentResponse.from(state, Orchestrator.GENERIC_FAILURE_MESSAGE);
        assertThat(response.getResponse()).isEqualTo(Orchestrator.GENERIC_FAILURE_MESSAGE)
                .doesNotContain("provider down");
    }

    @Test
    void submit_unexpectedException_failsAsInternal() {
        when(intentParser.parse(any(), any())).thenReturn(plan(Intent.FACTUAL_QUERY, TOP_ARTISTS_CALL));
        when(dataFetchExecutor.execute(anyList(), anyString(), any())).thenThrow(new IllegalStateException("bug"));

        AgentState state = orchestrator.submit(null, "Who were my top artists?");

        assertThat(state.getStage()).isEqualTo(Stage.FAILED);
        assertThat(state.getFailure().getKind()).isEqualTo(ErrorKind.INTERNAL);
        assertThat(state.getFailure().getStage()).isEqualTo(Stage.DATA_FETCHING);
        verifyNoInteractions(analyst);
    }

    @Test
    void submit_cancelledDuringStage_endsCancelled() {
        when(intentParser.parse(any(), any())).thenReturn(plan(Intent.FACTUAL_QUERY, TOP_ARTISTS_CALL));
        when(dataFetchExecutor.execute(anyList(), anyString(), any()))
                .thenThrow(new TurnCancelledException("Turn was cancelled"));

        AgentState state = orchestrator.submit(null, "Who were my top artists?", new CancellationToken());

        assertThat(state.getStage()).isEqualTo(Stage.CANCELLED);
        assertThat(state.getFinalResponse()).isNull();
        assertThat(state.getErrorTrace()).extracting(ErrorRecord::getKind).containsExactly(ErrorKind.CANCELLED);
        verifyNoInteractions(analyst);
    }

    @Test
    void submit_preCancelledToken_neverParses() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        AgentState state = orchestrator.submit(null, "Who were my top artists?", token);

        assertThat(state.getStage()).isEqualTo(Stage.CANCELLED);
        verify(intentParser, never()).parse(any(), any());
    }

    @Test
    void submit_unavailableAfterCancel_reportsCancelled() {
        CancellationToken token = new CancellationToken();
        when(intentParser.parse(any(), any())).thenAnswer(inv -> {
            token.cancel();
            throw new GenerationUnavailableException("interrupted");
        });

        AgentState state = orchestrator.submit(null, "Who were my top artists?", token);

        assertThat(state.getStage()).isEqualTo(Stage.CANCELLED);
    }

    @Test
    void submit_continuation_keepsIdAndAppendsHistory() {
        when(intentParser.parse(any(), any())).thenReturn(plan(Intent.OTHER));
        when(analyst.analyze(any(), any())).thenReturn("first answer", "second answer");

        AgentState first = orchestrator.start("conv-7", "hello", new CancellationToken());
        AgentState second = orchestrator.submit(first, "and again", new CancellationToken());

        assertThat(second.getConversationId()).isEqualTo("conv-7");
        assertThat(second.getHistory()).hasSize(1);
        assertThat(second.getHistory().get(0).getUserQuery()).isEqualTo("hello");
        assertThat(second.getHistory().get(0).getResponse()).isEqualTo("first answer");
        assertThat(second.getFinalResponse()).isEqualTo("second answer");
    }
}
