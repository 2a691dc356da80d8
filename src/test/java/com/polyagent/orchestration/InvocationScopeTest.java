package com.polyagent.orchestration;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class InvocationScopeTest {

    @Test
    void testRemainingMillisSaturates() {
        InvocationScope scope = new InvocationScope("far", Instant.MAX);

        assertEquals(Long.MAX_VALUE, scope.remainingMillis());
        assertFalse(scope.isExpired());
    }

    @Test
    void testExpiredScope() {
        InvocationScope scope = new InvocationScope("past", Instant.now().minusSeconds(1));

        assertEquals(0, scope.remainingMillis());
        assertTrue(scope.isExpired());
        assertThrows(CancellationException.class, scope::ensureActive);
    }

    @Test
    void testCancelInterruptsTrackedFutures() {
        InvocationScope scope = new InvocationScope("s1", Instant.now().plusSeconds(60));
        CompletableFuture<String> inFlight = new CompletableFuture<>();
        scope.track(inFlight);

        scope.cancel();

        assertTrue(inFlight.isCancelled());
        assertTrue(scope.isCancelled());
        CompletableFuture<String> late = new CompletableFuture<>();
        scope.track(late);
        assertTrue(late.isCancelled());
    }
}
