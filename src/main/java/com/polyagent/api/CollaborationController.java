package com.polyagent.api;

import com.polyagent.agent.AgentDescriptor;
import com.polyagent.config.PolyAgentProperties;
import com.polyagent.orchestration.CollaborationException;
import com.polyagent.orchestration.CollaborationOrchestrator;
import com.polyagent.orchestration.model.CollaborationResult;
import com.polyagent.session.CollaborationSession;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@RestController
@RequestMapping("/api/collaboration")
@Slf4j
public class CollaborationController {

    private final CollaborationOrchestrator orchestrator;
    private final PolyAgentProperties properties;
    private final ExecutorService collaborationExecutor;

    public CollaborationController(CollaborationOrchestrator orchestrator,
                                   PolyAgentProperties properties,
                                   @Qualifier("collaborationExecutor") ExecutorService collaborationExecutor) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.collaborationExecutor = collaborationExecutor;
    }

    @GetMapping("/paradigms")
    public List<ParadigmResponse> paradigms() {
        return orchestrator.listParadigms().stream().map(ParadigmResponse::from).toList();
    }

    @GetMapping("/agents")
    public List<AgentDescriptor> agents() {
        return orchestrator.listAgents();
    }

    @PostMapping("/collaborate")
    public CollaborationResult collaborate(@Valid @RequestBody CollaborateRequest request) {
        return orchestrator.collaborate(request.sessionId(), request.paradigm(), request.task(),
                agentsOrDefault(request.agents()), deadline(request));
    }

    /**
     * Starts a collaboration in the background; progress is published on the session's WebSocket stream.
     */
    @PostMapping("/collaborate/stream")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public CollaborationStreamResponse collaborateStream(@Valid @RequestBody CollaborateRequest request) {
        List<String> agents = agentsOrDefault(request.agents());
        orchestrator.openSession(request.sessionId(), request.paradigm(), agents);
        CompletableFuture.runAsync(() -> {
            try {
                orchestrator.collaborate(request.sessionId(), request.paradigm(), request.task(), agents,
                        deadline(request));
            } catch (CollaborationException ex) {
                log.warn("Streamed collaboration {} ended with {}: {}", request.sessionId(), ex.getKind(), ex.getMessage());
            }
        }, collaborationExecutor);
        return new CollaborationStreamResponse(request.sessionId(),
                "/ws/collaboration?sessionId=" + request.sessionId(), Instant.now());
    }

    @GetMapping("/sessions")
    public List<CollaborationSession> sessions() {
        return orchestrator.listSessions();
    }

    @PostMapping("/sessions")
    @ResponseStatus(HttpStatus.CREATED)
    public CollaborationSession openSession(@Valid @RequestBody OpenSessionRequest request) {
        return orchestrator.openSession(request.sessionId(), request.paradigm(), request.agents());
    }

    @GetMapping("/sessions/{sessionId}")
    public CollaborationSession session(@PathVariable String sessionId) {
        return orchestrator.getSession(sessionId);
    }

    @DeleteMapping("/sessions/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void resetSession(@PathVariable String sessionId) {
        orchestrator.resetSession(sessionId);
    }

    @PostMapping("/sessions/{sessionId}/cancel")
    public CollaborationSession cancel(@PathVariable String sessionId) {
        return orchestrator.cancel(sessionId);
    }

    private List<String> agentsOrDefault(List<String> agents) {
        return agents != null ? agents : properties.getDefaultAgents();
    }

    private Duration deadline(CollaborateRequest request) {
        return request.deadlineSeconds() != null ? Duration.ofSeconds(request.deadlineSeconds()) : null;
    }
}
