package com.polyagent.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class OrchestrationMetricsService implements MetricsSink {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";

    private final MeterRegistry meterRegistry;
    private final Counter sessionsStarted;
    private final Counter sessionsCompleted;
    private final Counter sessionsFailed;

    private final AtomicLong agentRequestCount = new AtomicLong();
    private final AtomicLong agentFailureCount = new AtomicLong();
    private final AtomicLong sessionCount = new AtomicLong();

    public OrchestrationMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.sessionsStarted = Counter.builder("collaboration.sessions.started")
                .description("Collaborations that entered the running state")
                .register(meterRegistry);
        this.sessionsCompleted = Counter.builder("collaboration.sessions.completed")
                .description("Collaborations that completed with a result")
                .register(meterRegistry);
        this.sessionsFailed = Counter.builder("collaboration.sessions.failed")
                .description("Collaborations that ended in failure")
                .register(meterRegistry);
    }

    @Override
    public void record(String agentId, Duration duration, boolean success) {
        try {
            String outcome = success ? OUTCOME_SUCCESS : OUTCOME_FAILURE;
            Counter.builder("agent.requests")
                    .description("Agent invocations by outcome")
                    .tag("agent", agentId)
                    .tag("outcome", outcome)
                    .register(meterRegistry)
                    .increment();
            Timer.builder("agent.request.duration")
                    .description("Agent invocation latency")
                    .tag("agent", agentId)
                    .register(meterRegistry)
                    .record(duration);
            long count = agentRequestCount.incrementAndGet();
            if (!success) {
                agentFailureCount.incrementAndGet();
            }
            log.info("Agent request #{} finished (agent={}, outcome={}, durationMs={}). Total requests={}.",
                    count, agentId, outcome, duration.toMillis(), count);
        } catch (RuntimeException ex) {
            log.warn("Failed to record metrics for agent {}: {}", agentId, ex.getMessage());
        }
    }

    public void recordSessionStarted(String sessionId, String paradigm) {
        sessionsStarted.increment();
        long count = sessionCount.incrementAndGet();
        log.info("Collaboration #{} started (session={}, paradigm={}).", count, sessionId, paradigm);
    }

    public void recordSessionCompleted(String sessionId) {
        sessionsCompleted.increment();
    }

    public void recordSessionFailed(String sessionId, String kind) {
        sessionsFailed.increment();
        log.info("Collaboration failed (session={}, kind={}).", sessionId, kind);
    }

    public long agentRequestCount() {
        return agentRequestCount.get();
    }

    public long agentFailureCount() {
        return agentFailureCount.get();
    }

    public void logSummary() {
        log.info("Agent stats: totalRequests={}, totalFailures={}, sessionsStarted={}, sessionsCompleted={}, sessionsFailed={}.",
                agentRequestCount.get(), agentFailureCount.get(), (long) sessionsStarted.count(),
                (long) sessionsCompleted.count(), (long) sessionsFailed.count());
    }
}
