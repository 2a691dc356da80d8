package com.polyagent.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationMetricsServiceTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final OrchestrationMetricsService metricsService = new OrchestrationMetricsService(registry);

    @Test
    void testRecordCountsByOutcome() {
        metricsService.record("gemini", Duration.ofMillis(120), true);
        metricsService.record("gemini", Duration.ofMillis(80), false);
        metricsService.record("claude", Duration.ofMillis(40), true);

        assertEquals(3, metricsService.agentRequestCount());
        assertEquals(1, metricsService.agentFailureCount());
        assertEquals(1.0, registry.get("agent.requests").tags("agent", "gemini", "outcome", "success").counter().count());
        assertEquals(1.0, registry.get("agent.requests").tags("agent", "gemini", "outcome", "failure").counter().count());
        assertEquals(2, registry.get("agent.request.duration").tag("agent", "gemini").timer().count());
    }

    @Test
    void testSessionCounters() {
        metricsService.recordSessionStarted("s1", "swarm");
        metricsService.recordSessionStarted("s2", "mesh");
        metricsService.recordSessionCompleted("s1");
        metricsService.recordSessionFailed("s2", "TIMEOUT");

        assertEquals(2.0, registry.get("collaboration.sessions.started").counter().count());
        assertEquals(1.0, registry.get("collaboration.sessions.completed").counter().count());
        assertEquals(1.0, registry.get("collaboration.sessions.failed").counter().count());
        assertDoesNotThrow(metricsService::logSummary);
    }
}
