package com.polyagent.orchestration;

import com.polyagent.agent.AgentDescriptor;
import com.polyagent.agent.AgentHandle;
import com.polyagent.agent.AgentHandleProvider;
import com.polyagent.config.PolyAgentProperties;
import com.polyagent.metrics.OrchestrationMetricsService;
import com.polyagent.orchestration.model.CollaborationResult;
import com.polyagent.orchestration.model.ParadigmPayload;
import com.polyagent.orchestration.paradigm.Paradigm;
import com.polyagent.orchestration.paradigm.ParadigmStrategy;
import com.polyagent.orchestration.paradigm.ParadigmStrategyService;
import com.polyagent.session.CollaborationSession;
import com.polyagent.session.SessionGuard;
import com.polyagent.session.SessionManager;
import com.polyagent.session.SessionState;
import com.polyagent.stream.CollaborationStreamService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for collaborations. Validates and resolves everything up front, guards the session,
 * runs the selected paradigm under the caller's deadline and stores the outcome.
 */
@Service
@Slf4j
public class CollaborationOrchestrator {

    private final AgentHandleProvider agentProvider;
    private final SessionManager sessionManager;
    private final ParadigmStrategyService strategyService;
    private final ExecutorService collaborationExecutor;
    private final PolyAgentProperties properties;
    private final OrchestrationMetricsService metricsService;
    private final CollaborationStreamService streamService;
    private final Map<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();

    public CollaborationOrchestrator(AgentHandleProvider agentProvider,
                                     SessionManager sessionManager,
                                     ParadigmStrategyService strategyService,
                                     @Qualifier("collaborationExecutor") ExecutorService collaborationExecutor,
                                     PolyAgentProperties properties,
                                     OrchestrationMetricsService metricsService,
                                     CollaborationStreamService streamService) {
        this.agentProvider = agentProvider;
        this.sessionManager = sessionManager;
        this.strategyService = strategyService;
        this.collaborationExecutor = collaborationExecutor;
        this.properties = properties;
        this.metricsService = metricsService;
        this.streamService = streamService;
    }

    @PreDestroy
    public void shutdown() {
        activeRuns.values().forEach(run -> run.scope().cancel());
        metricsService.logSummary();
    }

    public CollaborationResult collaborate(String sessionId, String paradigmId, String task, List<String> agentIds) {
        return collaborate(sessionId, paradigmId, task, agentIds, null);
    }

    /**
     * Runs one collaboration to completion.
     *
     * @param deadline Budget for the whole call; the configured default applies when {@code null}.
     * @throws CollaborationException for validation failures (before any session exists), a busy or
     *                                closed session, timeout, cancellation or a paradigm failure.
     */
    public CollaborationResult collaborate(String sessionId,
                                           String paradigmId,
                                           String task,
                                           List<String> agentIds,
                                           @Nullable Duration deadline) {
        if (!StringUtils.hasText(sessionId)) {
            throw new CollaborationException(CollaborationErrorKind.INVALID_REQUEST, "Session id must not be blank.");
        }
        Paradigm paradigm = Paradigm.fromId(paradigmId);
        if (!StringUtils.hasText(task)) {
            throw new CollaborationException(CollaborationErrorKind.INVALID_REQUEST, "Task must not be blank.");
        }
        if (agentIds == null || agentIds.isEmpty()) {
            throw new CollaborationException(CollaborationErrorKind.NO_AGENTS,
                    "At least one agent is required for " + paradigm.id() + ".");
        }
        List<String> agents = List.copyOf(agentIds);
        List<AgentHandle> handles = resolveAll(agents);
        Duration budget = effectiveBudget(deadline);

        SessionGuard guard = sessionManager.begin(sessionId, paradigm, task, agents);
        ActiveRun run = null;
        try {
            Instant startedAt = Instant.now();
            run = new ActiveRun(new InvocationScope(sessionId, startedAt.plus(budget)), guard);
            activeRuns.put(sessionId, run);
            streamService.openStream(sessionId);
            streamService.emitSessionStart(sessionId, paradigm, task, agents);
            metricsService.recordSessionStarted(sessionId, paradigm.id());
            ParadigmPayload payload = execute(run, strategyService.strategyFor(paradigm), task, handles, budget);
            CollaborationResult result = new CollaborationResult(sessionId, paradigm, task, agents, payload,
                    startedAt, Instant.now());
            if (!sessionManager.complete(guard, result)) {
                throw failRun(guard, CollaborationErrorKind.CANCELLED,
                        "Collaboration " + sessionId + " was cancelled before it could complete.", null);
            }
            streamService.emitSessionComplete(sessionId, result);
            metricsService.recordSessionCompleted(sessionId);
            log.info("Collaboration {} finished ({}, {} agents, {} failed).", sessionId, paradigm.id(),
                    agents.size(), payload.failedAgents().size());
            return result;
        } catch (CollaborationException ex) {
            // No-op when the run already ended
            throw failRun(guard, ex.getKind(), ex.getMessage(), ex.getCause());
        } catch (RuntimeException ex) {
            throw failRun(guard, CollaborationErrorKind.PARADIGM_EXECUTION_ERROR,
                    "Collaboration " + sessionId + " failed: " + ex.getMessage(), ex);
        } finally {
            if (run != null) {
                activeRuns.remove(sessionId, run);
            }
        }
    }

    /**
     * Cancels an in-flight collaboration. In-flight agent calls are interrupted and the session fails
     * with {@code CANCELLED}.
     */
    public CollaborationSession cancel(String sessionId) {
        ActiveRun run = activeRuns.get(sessionId);
        if (run == null) {
            CollaborationSession session = sessionManager.get(sessionId);
            throw new CollaborationException(session.state().isTerminal()
                    ? CollaborationErrorKind.SESSION_CLOSED
                    : CollaborationErrorKind.INVALID_REQUEST,
                    sessionId, "Session " + sessionId + " is not running.");
        }
        run.scope().cancel();
        failRun(run.guard(), CollaborationErrorKind.CANCELLED, "Collaboration cancelled by request.", null);
        return sessionManager.get(sessionId);
    }

    public CollaborationSession openSession(String sessionId, @Nullable String paradigmId, @Nullable List<String> agentIds) {
        if (!StringUtils.hasText(sessionId)) {
            throw new CollaborationException(CollaborationErrorKind.INVALID_REQUEST, "Session id must not be blank.");
        }
        Paradigm paradigm = StringUtils.hasText(paradigmId) ? Paradigm.fromId(paradigmId) : null;
        List<String> agents = agentIds != null ? List.copyOf(agentIds) : List.of();
        ensureRegistered(agents);
        CollaborationSession session = sessionManager.open(sessionId, paradigm, agents);
        streamService.openStream(sessionId);
        return session;
    }

    public CollaborationSession getSession(String sessionId) {
        return sessionManager.get(sessionId);
    }

    public List<CollaborationSession> listSessions() {
        return sessionManager.list();
    }

    public void resetSession(String sessionId) {
        sessionManager.reset(sessionId);
        streamService.discardStream(sessionId);
    }

    public List<Paradigm> listParadigms() {
        return Arrays.asList(Paradigm.values());
    }

    public List<AgentDescriptor> listAgents() {
        return agentProvider.describeAgents();
    }

    /**
     * The requested deadline, or the configured default, capped at {@code max-collaboration-deadline}.
     */
    private Duration effectiveBudget(@Nullable Duration requested) {
        Duration budget = requested != null && !requested.isNegative() && !requested.isZero()
                ? requested
                : properties.getCollaborationDeadline();
        Duration max = properties.getMaxCollaborationDeadline();
        return budget.compareTo(max) > 0 ? max : budget;
    }

    private ParadigmPayload execute(ActiveRun run, ParadigmStrategy strategy, String task,
                                    List<AgentHandle> handles, Duration budget) {
        InvocationScope scope = run.scope();
        SessionGuard guard = run.guard();
        Future<ParadigmPayload> future;
        try {
            future = collaborationExecutor.submit(() -> strategy.run(scope, task, handles));
        } catch (RejectedExecutionException ex) {
            throw failRun(guard, CollaborationErrorKind.PARADIGM_EXECUTION_ERROR,
                    "Collaboration executor rejected the run.", ex);
        }
        scope.track(future);
        try {
            return future.get(Math.max(1L, scope.remainingMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            scope.cancel();
            throw failRun(guard, CollaborationErrorKind.TIMEOUT,
                    "Collaboration exceeded its deadline of " + budget + ".", ex);
        } catch (CancellationException ex) {
            throw failRun(guard, CollaborationErrorKind.CANCELLED, "Collaboration cancelled by request.", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            scope.cancel();
            throw failRun(guard, CollaborationErrorKind.CANCELLED, "Collaboration interrupted.", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (scope.isCancelled()) {
                throw failRun(guard, CollaborationErrorKind.CANCELLED, "Collaboration cancelled by request.", cause);
            }
            if (cause instanceof CancellationException && scope.isExpired()) {
                throw failRun(guard, CollaborationErrorKind.TIMEOUT,
                        "Collaboration exceeded its deadline of " + budget + ".", cause);
            }
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            throw failRun(guard, CollaborationErrorKind.PARADIGM_EXECUTION_ERROR, message, cause);
        } finally {
            scope.untrack(future);
        }
    }

    private CollaborationException failRun(SessionGuard guard, CollaborationErrorKind kind, String message,
                                           @Nullable Throwable cause) {
        String sessionId = guard.sessionId();
        if (sessionManager.fail(guard, kind, message)) {
            streamService.emitError(sessionId, kind, message);
            metricsService.recordSessionFailed(sessionId, kind.name());
            return new CollaborationException(kind, sessionId, message, cause);
        }
        // Another path already ended the run; report what the session recorded
        CollaborationSession session = sessionManager.get(sessionId);
        CollaborationErrorKind recorded = session.state() == SessionState.FAILED && session.errorKind() != null
                ? session.errorKind()
                : kind;
        String recordedMessage = session.errorMessage() != null ? session.errorMessage() : message;
        return new CollaborationException(recorded, sessionId, recordedMessage, cause);
    }

    private List<AgentHandle> resolveAll(List<String> agentIds) {
        Set<String> seen = new HashSet<>();
        for (String agentId : agentIds) {
            if (!StringUtils.hasText(agentId)) {
                throw new CollaborationException(CollaborationErrorKind.INVALID_REQUEST, "Agent ids must not be blank.");
            }
            if (!seen.add(agentId)) {
                throw new CollaborationException(CollaborationErrorKind.INVALID_REQUEST,
                        "Agent " + agentId + " is listed more than once.");
            }
        }
        ensureRegistered(agentIds);
        List<AgentHandle> handles = new ArrayList<>(agentIds.size());
        for (String agentId : agentIds) {
            handles.add(agentProvider.resolve(agentId));
        }
        return List.copyOf(handles);
    }

    private void ensureRegistered(List<String> agentIds) {
        List<String> unknown = agentIds.stream()
                .filter(agentId -> !agentProvider.isRegistered(agentId))
                .toList();
        if (!unknown.isEmpty()) {
            throw new CollaborationException(CollaborationErrorKind.UNKNOWN_AGENT, "Unknown agents: " + unknown + ".");
        }
    }

    private record ActiveRun(InvocationScope scope, SessionGuard guard) {
    }
}
