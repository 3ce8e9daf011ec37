package com.deepansh.historyagent.fetch;

import com.deepansh.historyagent.config.AgentProperties;
import com.deepansh.historyagent.core.CancellationToken;
import com.deepansh.historyagent.exception.ArgumentResolutionException;
import com.deepansh.historyagent.exception.ToolExecutionException;
import com.deepansh.historyagent.exception.TurnCancelledException;
import com.deepansh.historyagent.model.ErrorKind;
import com.deepansh.historyagent.model.ErrorRecord;
import com.deepansh.historyagent.model.FetchResult;
import com.deepansh.historyagent.model.Stage;
import com.deepansh.historyagent.model.ToolCall;
import com.deepansh.historyagent.resilience.PolicyExecutor;
import com.deepansh.historyagent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Executes a tool plan concurrently and returns exactly one {@link FetchResult} per call.
 *
 * Per call: resolve arguments, invoke through the tool retry policy, truncate the payload.
 * Calls never fail the stage; their problems are recorded in the result. The stage as a
 * whole is bounded by the aggregate fetch timeout, after which unfinished calls are
 * interrupted and reported as timed out.
 */
@Component
@Slf4j
public class DataFetchExecutor {

    private static final Predicate<Throwable> RETRYABLE = ex ->
            ex instanceof TimeoutException
                    || (ex instanceof ToolExecutionException tee && tee.isRetryable());

    private final ToolRegistry toolRegistry;
    private final ArgumentResolver argumentResolver;
    private final PolicyExecutor policyExecutor;
    private final PayloadTruncator truncator;
    private final AgentProperties properties;
    private final ExecutorService workers;

    public DataFetchExecutor(ToolRegistry toolRegistry,
                             ArgumentResolver argumentResolver,
                             PolicyExecutor policyExecutor,
                             PayloadTruncator truncator,
                             AgentProperties properties,
                             @Qualifier("fetchWorkerExecutor") ExecutorService workers) {
        this.toolRegistry = toolRegistry;
        this.argumentResolver = argumentResolver;
        this.policyExecutor = policyExecutor;
        this.truncator = truncator;
        this.properties = properties;
        this.workers = workers;
    }

    public FetchOutcome execute(List<ToolCall> plan, String userQuery, CancellationToken token) {
        token.throwIfCancelled();
        long started = System.currentTimeMillis();

        List<CallTracker> trackers = new ArrayList<>(plan.size());
        List<Future<CallOutcome>> futures = new ArrayList<>(plan.size());
        for (ToolCall call : plan) {
            CallTracker tracker = new CallTracker(call);
            trackers.add(tracker);
            Future<CallOutcome> future = workers.submit(() -> runCall(call, userQuery, token, tracker));
            token.register(future);
            futures.add(future);
        }

        List<FetchResult> results = new ArrayList<>(plan.size());
        List<ErrorRecord> errors = new ArrayList<>();
        long deadline = System.nanoTime() + properties.getAggregateFetchTimeout().toNanos();

        try {
            for (int i = 0; i < futures.size(); i++) {
                CallOutcome outcome = await(futures.get(i), trackers.get(i), deadline, token);
                results.add(outcome.result());
                if (outcome.error() != null) {
                    errors.add(outcome.error());
                }
            }
        } finally {
            for (Future<CallOutcome> future : futures) {
                token.unregister(future);
                future.cancel(true);
            }
        }

        log.info("Data fetch complete [calls={}, ok={}, latency={}ms]",
                results.size(), results.stream().filter(FetchResult::isOk).count(),
                System.currentTimeMillis() - started);
        return new FetchOutcome(List.copyOf(results), List.copyOf(errors));
    }

    private CallOutcome await(Future<CallOutcome> future, CallTracker tracker, long deadline, CancellationToken token) {
        try {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0 && !future.isDone()) {
                throw new TimeoutException();
            }
            return future.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            String name = tracker.call.getName();
            String message = "Aggregate fetch timeout of " + properties.getAggregateFetchTimeout().toMillis() + "ms exceeded";
            log.warn("Tool call [{}] cancelled: {}", name, message);
            return new CallOutcome(
                    FetchResult.timedOut(name, message, tracker.attempts.get(), tracker.resolvedArguments),
                    ErrorRecord.forTool(Stage.DATA_FETCHING, ErrorKind.TIMEOUT, name, message));
        } catch (CancellationException e) {
            token.throwIfCancelled();
            throw new TurnCancelledException("Tool call " + tracker.call.getName() + " was cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnCancelledException("Interrupted while waiting for tool calls");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TurnCancelledException tce) {
                throw tce;
            }
            String name = tracker.call.getName();
            log.error("Tool call [{}] failed unexpectedly", name, e.getCause());
            return new CallOutcome(
                    FetchResult.failed(name, String.valueOf(e.getCause()), tracker.attempts.get(), tracker.resolvedArguments),
                    ErrorRecord.forTool(Stage.DATA_FETCHING, ErrorKind.INTERNAL, name, String.valueOf(e.getCause())));
        }
    }

    private CallOutcome runCall(ToolCall call, String userQuery, CancellationToken token, CallTracker tracker) {
        String name = call.getName();

        Map<String, Object> args;
        try {
            args = argumentResolver.resolve(call, userQuery, token);
        } catch (ArgumentResolutionException e) {
            log.warn("Argument resolution failed for [{}]: {}", name, e.getMessage());
            return new CallOutcome(
                    FetchResult.failed(name, e.getMessage(), 0, call.getRawArgsSpec()),
                    ErrorRecord.forTool(Stage.DATA_FETCHING, ErrorKind.ARGUMENT_RESOLUTION_ERROR, name, e.getMessage()));
        }
        tracker.resolvedArguments = args;

        try {
            List<Map<String, Object>> rows = policyExecutor.execute(
                    properties.toolCallPolicy(name),
                    () -> toolRegistry.invoke(name, args),
                    RETRYABLE,
                    token,
                    tracker.attempts);

            PayloadTruncator.TruncatedPayload payload = truncator.truncate(rows);
            if (payload.truncated()) {
                log.info("Tool [{}] payload truncated [kept={}, total={}]",
                        name, payload.keptRecords(), payload.totalRecords());
            }
            return new CallOutcome(
                    FetchResult.ok(name, payload.payload(), payload.truncated(), tracker.attempts.get(), args),
                    null);
        } catch (TimeoutException e) {
            String message = "Timed out after " + tracker.attempts.get() + " attempt(s)";
            log.warn("Tool call [{}] {}", name, message);
            return new CallOutcome(
                    FetchResult.timedOut(name, message, tracker.attempts.get(), args),
                    ErrorRecord.forTool(Stage.DATA_FETCHING, ErrorKind.TIMEOUT, name, message));
        } catch (TurnCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Tool call [{}] failed after {} attempt(s): {}", name, tracker.attempts.get(), e.getMessage());
            return new CallOutcome(
                    FetchResult.failed(name, e.getMessage(), tracker.attempts.get(), args),
                    ErrorRecord.forTool(Stage.DATA_FETCHING, ErrorKind.TOOL_EXECUTION_ERROR, name, e.getMessage()));
        }
    }

    private record CallOutcome(FetchResult result, ErrorRecord error) {}

    /** Progress of one call, readable by the waiting thread when the call is abandoned */
    private static final class CallTracker {
        final ToolCall call;
        final AtomicInteger attempts = new AtomicInteger();
        volatile Map<String, Object> resolvedArguments = Map.of();

        CallTracker(ToolCall call) {
            this.call = call;
        }
    }
}
