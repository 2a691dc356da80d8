package com.polyagent.orchestration;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Per-collaboration cancellation boundary. Every agent call started for a session is tracked here
 * so that a deadline expiry or an explicit cancel can interrupt all of them at once.
 */
public class InvocationScope {

    private final String sessionId;
    private final Instant deadline;
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    public InvocationScope(String sessionId, Instant deadline) {
        this.sessionId = sessionId;
        this.deadline = deadline;
    }

    public String sessionId() {
        return sessionId;
    }

    public Instant deadline() {
        return deadline;
    }

    public Duration remaining() {
        Duration remaining = Duration.between(Instant.now(), deadline);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public long remainingMillis() {
        try {
            return remaining().toMillis();
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }

    public boolean isExpired() {
        return !Instant.now().isBefore(deadline);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void track(Future<?> future) {
        inFlight.add(future);
        if (cancelled) {
            future.cancel(true);
        }
    }

    public void untrack(Future<?> future) {
        inFlight.remove(future);
    }

    public void cancel() {
        cancelled = true;
        inFlight.forEach(future -> future.cancel(true));
        inFlight.clear();
    }

    /**
     * Stops a strategy between steps once the scope is cancelled or past its deadline.
     */
    public void ensureActive() {
        if (cancelled) {
            throw new CancellationException("Collaboration " + sessionId + " was cancelled.");
        }
        if (isExpired()) {
            throw new CancellationException("Collaboration " + sessionId + " exceeded its deadline.");
        }
    }
}
