package com.polyagent.orchestration;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.polyagent.agent.AgentHandleProvider;
import com.polyagent.config.PolyAgentProperties;
import com.polyagent.metrics.OrchestrationMetricsService;
import com.polyagent.orchestration.api.AgentInvocationService;
import com.polyagent.orchestration.paradigm.EcosystemStrategy;
import com.polyagent.orchestration.paradigm.MeshStrategy;
import com.polyagent.orchestration.paradigm.OrchestraStrategy;
import com.polyagent.orchestration.paradigm.ParadigmStrategyService;
import com.polyagent.orchestration.paradigm.SwarmStrategy;
import com.polyagent.orchestration.paradigm.WeaverStrategy;
import com.polyagent.orchestration.service.AgentInvocationServiceImpl;
import com.polyagent.orchestration.service.CollaborationContextService;
import com.polyagent.orchestration.service.ParadigmPromptService;
import com.polyagent.orchestration.service.ResponseAnalysisService;
import com.polyagent.session.SessionManager;
import com.polyagent.stream.CollaborationStreamHub;
import com.polyagent.stream.CollaborationStreamService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the orchestration services by hand, without a Spring context.
 */
public class OrchestrationFixture implements AutoCloseable {

    public final PolyAgentProperties properties;
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final OrchestrationMetricsService metricsService = new OrchestrationMetricsService(meterRegistry);
    public final CollaborationStreamHub streamHub;
    public final CollaborationStreamService streamService;
    public final ExecutorService workerExecutor = Executors.newFixedThreadPool(8);
    public final ExecutorService collaborationExecutor = Executors.newCachedThreadPool();
    public final AgentInvocationService invocationService;
    public final ParadigmPromptService promptService = new ParadigmPromptService();
    public final CollaborationContextService contextService = new CollaborationContextService();
    public final ResponseAnalysisService analysisService;
    public final OrchestraStrategy orchestraStrategy;
    public final MeshStrategy meshStrategy;
    public final SwarmStrategy swarmStrategy;
    public final WeaverStrategy weaverStrategy;
    public final EcosystemStrategy ecosystemStrategy;
    public final ParadigmStrategyService strategyService;
    public final SessionManager sessionManager;

    public OrchestrationFixture() {
        this(defaultProperties());
    }

    public OrchestrationFixture(PolyAgentProperties properties) {
        this.properties = properties;
        this.streamHub = new CollaborationStreamHub(JsonMapper.builder().findAndAddModules().build(), properties);
        this.streamService = new CollaborationStreamService(streamHub);
        this.invocationService = new AgentInvocationServiceImpl(workerExecutor, properties, metricsService, streamService);
        this.analysisService = new ResponseAnalysisService(properties);
        this.orchestraStrategy = new OrchestraStrategy(invocationService, promptService);
        this.meshStrategy = new MeshStrategy(invocationService, promptService, contextService, properties);
        this.swarmStrategy = new SwarmStrategy(invocationService, promptService, analysisService);
        this.weaverStrategy = new WeaverStrategy(invocationService, promptService, contextService);
        this.ecosystemStrategy = new EcosystemStrategy(invocationService, promptService, analysisService, properties);
        this.strategyService = new ParadigmStrategyService(orchestraStrategy, meshStrategy, swarmStrategy,
                weaverStrategy, ecosystemStrategy);
        this.sessionManager = new SessionManager(properties);
    }

    public static PolyAgentProperties defaultProperties() {
        PolyAgentProperties properties = new PolyAgentProperties();
        properties.setAgentTimeout(Duration.ofSeconds(2));
        properties.setCollaborationDeadline(Duration.ofSeconds(10));
        properties.getParadigms().setMeshRounds(2);
        properties.getParadigms().setEcosystemGenerations(2);
        return properties;
    }

    public CollaborationOrchestrator orchestrator(AgentHandleProvider provider) {
        return new CollaborationOrchestrator(provider, sessionManager, strategyService, collaborationExecutor,
                properties, metricsService, streamService);
    }

    public InvocationScope scope(String sessionId) {
        streamService.openStream(sessionId);
        return new InvocationScope(sessionId, Instant.now().plus(properties.getCollaborationDeadline()));
    }

    @Override
    public void close() {
        workerExecutor.shutdownNow();
        collaborationExecutor.shutdownNow();
    }
}
