package com.deepansh.historyagent.core;

import com.deepansh.historyagent.exception.TurnCancelledException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Turn-level cancellation signal.
 *
 * Work started on behalf of a turn registers its {@link Future} here; {@link #cancel()}
 * interrupts every registered future, and anything registered afterwards is cancelled
 * on registration.
 */
public class CancellationToken {

    private volatile boolean cancelled;
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

    public void cancel() {
        cancelled = true;
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new TurnCancelledException("Turn was cancelled");
        }
    }

    public void register(Future<?> future) {
        inFlight.add(future);
        // cancel() may have run between the caller's check and the add
        if (cancelled) {
            future.cancel(true);
        }
    }

    public void unregister(Future<?> future) {
        inFlight.remove(future);
    }
}
