package com.polyagent.orchestration.service;

import com.polyagent.agent.AgentException;
import com.polyagent.agent.AgentHandle;
import com.polyagent.agent.AgentResponse;
import com.polyagent.config.PolyAgentProperties;
import com.polyagent.metrics.MetricsSink;
import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.InvocationScope;
import com.polyagent.orchestration.api.AgentInvocationService;
import com.polyagent.orchestration.model.AgentInvocationResult;
import com.polyagent.orchestration.model.InvocationRecord;
import com.polyagent.stream.CollaborationStreamService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

@Service
@Slf4j
public class AgentInvocationServiceImpl implements AgentInvocationService {

    private final ExecutorService workerExecutor;
    private final PolyAgentProperties properties;
    private final MetricsSink metricsSink;
    private final CollaborationStreamService streamService;

    public AgentInvocationServiceImpl(@Qualifier("agentWorkerExecutor") ExecutorService workerExecutor,
                                      PolyAgentProperties properties,
                                      MetricsSink metricsSink,
                                      CollaborationStreamService streamService) {
        this.workerExecutor = workerExecutor;
        this.properties = properties;
        this.metricsSink = metricsSink;
        this.streamService = streamService;
    }

    @Override
    public AgentInvocationResult invoke(InvocationScope scope,
                                        AgentHandle handle,
                                        String task,
                                        @Nullable String context,
                                        String purpose) {
        scope.ensureActive();
        AgentInvocationResult result = invokeAsync(scope, handle, task, context, purpose).join();
        scope.ensureActive();
        return result;
    }

    @Override
    public List<AgentInvocationResult> invokeAll(InvocationScope scope,
                                                 List<AgentHandle> handles,
                                                 Function<AgentHandle, String> taskFor,
                                                 Function<AgentHandle, String> contextFor,
                                                 String purpose) {
        scope.ensureActive();
        List<CompletableFuture<AgentInvocationResult>> futures = handles.stream()
                .map(handle -> invokeAsync(scope, handle, taskFor.apply(handle), contextFor.apply(handle), purpose))
                .toList();
        List<AgentInvocationResult> results = futures.stream()
                .map(CompletableFuture::join)
                .toList();
        scope.ensureActive();
        return results;
    }

    private CompletableFuture<AgentInvocationResult> invokeAsync(InvocationScope scope,
                                                                 AgentHandle handle,
                                                                 String task,
                                                                 @Nullable String context,
                                                                 String purpose) {
        Duration timeout = effectiveTimeout(scope);
        Instant startedAt = Instant.now();
        CompletableFuture<AgentResponse> call = new CompletableFuture<>();
        Future<?> worker;
        try {
            worker = workerExecutor.submit(() -> {
                try {
                    call.complete(handle.invoke(task, context));
                } catch (AgentException | RuntimeException ex) {
                    call.completeExceptionally(ex);
                }
            });
        } catch (RejectedExecutionException ex) {
            call.completeExceptionally(ex);
            worker = null;
        }
        Future<?> tracked = worker;
        if (tracked != null) {
            scope.track(tracked);
        }
        // Cancelling the promise releases waiting strategies without waiting for the worker to notice
        scope.track(call);
        return call
                .orTimeout(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS)
                .handle((response, ex) -> {
                    scope.untrack(call);
                    if (tracked != null) {
                        scope.untrack(tracked);
                        if (ex != null) {
                            tracked.cancel(true);
                        }
                    }
                    AgentInvocationResult result = toResult(handle.id(), startedAt, response, ex);
                    publish(scope, purpose, result);
                    return result;
                });
    }

    private Duration effectiveTimeout(InvocationScope scope) {
        Duration agentTimeout = properties.getAgentTimeout();
        Duration remaining = scope.remaining();
        return remaining.compareTo(agentTimeout) < 0 ? remaining : agentTimeout;
    }

    private AgentInvocationResult toResult(String agentId, Instant startedAt,
                                           @Nullable AgentResponse response, @Nullable Throwable ex) {
        Instant endedAt = Instant.now();
        if (ex == null && response != null) {
            return new AgentInvocationResult(agentId, response.response(),
                    InvocationRecord.succeeded(agentId, startedAt, endedAt));
        }
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        CollaborationErrorKind kind;
        String message;
        if (cause instanceof TimeoutException) {
            kind = CollaborationErrorKind.TIMEOUT;
            message = "Agent " + agentId + " timed out.";
        } else if (cause instanceof CancellationException) {
            kind = CollaborationErrorKind.CANCELLED;
            message = "Agent " + agentId + " call was cancelled.";
        } else {
            kind = CollaborationErrorKind.AGENT_ERROR;
            message = cause != null && cause.getMessage() != null
                    ? cause.getMessage()
                    : "Agent " + agentId + " returned no response.";
        }
        return new AgentInvocationResult(agentId, null,
                InvocationRecord.failed(agentId, startedAt, endedAt, kind, message));
    }

    private void publish(InvocationScope scope, String purpose, AgentInvocationResult result) {
        InvocationRecord record = result.record();
        metricsSink.record(record.agentId(), record.duration(), record.success());
        if (!record.success()) {
            log.warn("Agent {} failed during {} (session={}, kind={}): {}", record.agentId(), purpose,
                    scope.sessionId(), record.errorKind(), record.errorMessage());
        }
        streamService.emitAgentResult(scope.sessionId(), purpose, result);
    }
}
