package com.deepansh.historyagent.resilience;

import com.deepansh.historyagent.core.CancellationToken;
import com.deepansh.historyagent.exception.AgentException;
import com.deepansh.historyagent.exception.TurnCancelledException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Runs a call under a {@link RetryPolicy}: every attempt is submitted to the
 * collaborator-call pool and bounded by a Resilience4j TimeLimiter, and attempts are
 * repeated by a Resilience4j Retry with exponential backoff.
 *
 * Outcome rules:
 * - an exception accepted by {@code retryable} is retried until attempts run out,
 *   then the last one is rethrown (a timeout on the final attempt surfaces as
 *   {@link TimeoutException})
 * - any other exception is rethrown immediately
 * - cancelling the token interrupts the running attempt and raises {@link TurnCancelledException}
 */
@Component
@Slf4j
public class PolicyExecutor {

    private final ExecutorService callExecutor;

    public PolicyExecutor(@Qualifier("collaboratorCallExecutor") ExecutorService callExecutor) {
        this.callExecutor = callExecutor;
    }

    public <T> T execute(RetryPolicy policy, Callable<T> call,
                         Predicate<Throwable> retryable, CancellationToken token) throws TimeoutException {
        return execute(policy, call, retryable, token, new AtomicInteger());
    }

    /**
     * @param attempts incremented once per attempt started, readable by the caller
     *                 whatever the outcome
     */
    public <T> T execute(RetryPolicy policy, Callable<T> call, Predicate<Throwable> retryable,
                         CancellationToken token, AtomicInteger attempts) throws TimeoutException {
        Retry retry = Retry.of(policy.getName(), RetryConfig.custom()
                .maxAttempts(policy.getMaxAttempts())
                .intervalFunction(policy.backoff())
                .retryOnException(ex -> !token.isCancelled() && retryable.test(ex))
                .build());

        retry.getEventPublisher().onRetry(event -> log.warn(
                "Retrying [{}] attempt {}/{} in {}ms: {}",
                policy.getName(), event.getNumberOfRetryAttempts() + 1, policy.getMaxAttempts(),
                event.getWaitInterval().toMillis(), describe(event.getLastThrowable())));

        TimeLimiter timeLimiter = TimeLimiter.of(policy.getName(), TimeLimiterConfig.custom()
                .timeoutDuration(policy.getPerCallTimeout())
                .cancelRunningFuture(true)
                .build());

        Callable<T> timedAttempt = () -> {
            token.throwIfCancelled();
            attempts.incrementAndGet();
            Future<T> future = callExecutor.submit(call);
            token.register(future);
            try {
                return timeLimiter.executeFutureSupplier(() -> future);
            } catch (CancellationException e) {
                token.throwIfCancelled();
                throw e;
            } finally {
                token.unregister(future);
                if (!future.isDone()) {
                    future.cancel(true);
                }
            }
        };

        try {
            return retry.executeCallable(timedAttempt);
        } catch (TimeoutException | RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnCancelledException("Interrupted while running " + policy.getName());
        } catch (Exception e) {
            throw new AgentException(policy.getName() + " failed: " + e.getMessage(), e);
        }
    }

    private static String describe(Throwable t) {
        return t == null ? "unknown" : t.getClass().getSimpleName() + ": " + t.getMessage();
    }
}
