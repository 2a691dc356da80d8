package com.polyagent.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "polyagent")
@Validated
public class PolyAgentProperties {

    @NotNull
    private Duration agentTimeout = Duration.ofSeconds(60);
    @NotNull
    private Duration collaborationDeadline = Duration.ofMinutes(5);
    @NotNull
    private Duration maxCollaborationDeadline = Duration.ofMinutes(30);
    @Min(1)
    private int workerConcurrency = 8;
    private List<String> defaultAgents = new ArrayList<>(List.of("gemini", "claude"));
    @Valid
    private Map<String, AgentDefinition> agents = new LinkedHashMap<>();
    @Valid
    private ParadigmConfig paradigms = new ParadigmConfig();
    @Valid
    private SessionConfig sessions = new SessionConfig();
    @Valid
    private BridgeConfig bridge = new BridgeConfig();

    public enum ScoringHeuristic {
        LENGTH, KEYWORD_DENSITY
    }

    public static class ParadigmConfig {
        @Min(1)
        private int meshRounds = 3;
        @Min(1)
        private int ecosystemGenerations = 3;
        private ScoringHeuristic ecosystemScoring = ScoringHeuristic.KEYWORD_DENSITY;
        @Min(1)
        private int swarmMinKeywordLength = 4;
        @Min(1)
        private int swarmMaxPatterns = 10;

        public int getMeshRounds() { return meshRounds; }
        public void setMeshRounds(int meshRounds) { this.meshRounds = meshRounds; }
        public int getEcosystemGenerations() { return ecosystemGenerations; }
        public void setEcosystemGenerations(int ecosystemGenerations) { this.ecosystemGenerations = ecosystemGenerations; }
        public ScoringHeuristic getEcosystemScoring() { return ecosystemScoring; }
        public void setEcosystemScoring(ScoringHeuristic ecosystemScoring) {
            if (ecosystemScoring == null) {
                return;
            }
            this.ecosystemScoring = ecosystemScoring;
        }
        public int getSwarmMinKeywordLength() { return swarmMinKeywordLength; }
        public void setSwarmMinKeywordLength(int swarmMinKeywordLength) { this.swarmMinKeywordLength = swarmMinKeywordLength; }
        public int getSwarmMaxPatterns() { return swarmMaxPatterns; }
        public void setSwarmMaxPatterns(int swarmMaxPatterns) { this.swarmMaxPatterns = swarmMaxPatterns; }
    }

    public static class SessionConfig {
        @Min(1)
        private int maxRetained = 500;
        @Min(1)
        private int streamBufferSize = 500;
        @NotNull
        private Duration streamRetention = Duration.ofMinutes(30);

        public int getMaxRetained() { return maxRetained; }
        public void setMaxRetained(int maxRetained) { this.maxRetained = maxRetained; }
        public int getStreamBufferSize() { return streamBufferSize; }
        public void setStreamBufferSize(int streamBufferSize) { this.streamBufferSize = streamBufferSize; }
        public Duration getStreamRetention() { return streamRetention; }
        public void setStreamRetention(Duration streamRetention) { this.streamRetention = streamRetention; }
    }

    public static class BridgeConfig {
        private boolean enabled;
        private String baseUrl = "http://localhost:8090";
        private Duration timeout = Duration.ofSeconds(30);
        private String healthEndpoint = "/health";
        private String generateEndpoint = "/generate-code";
        private String analyzeEndpoint = "/analyze-code";
        private String optimizeEndpoint = "/optimize-code";
        private String debugEndpoint = "/debug-code";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public String getHealthEndpoint() { return healthEndpoint; }
        public void setHealthEndpoint(String healthEndpoint) { this.healthEndpoint = healthEndpoint; }
        public String getGenerateEndpoint() { return generateEndpoint; }
        public void setGenerateEndpoint(String generateEndpoint) { this.generateEndpoint = generateEndpoint; }
        public String getAnalyzeEndpoint() { return analyzeEndpoint; }
        public void setAnalyzeEndpoint(String analyzeEndpoint) { this.analyzeEndpoint = analyzeEndpoint; }
        public String getOptimizeEndpoint() { return optimizeEndpoint; }
        public void setOptimizeEndpoint(String optimizeEndpoint) { this.optimizeEndpoint = optimizeEndpoint; }
        public String getDebugEndpoint() { return debugEndpoint; }
        public void setDebugEndpoint(String debugEndpoint) { this.debugEndpoint = debugEndpoint; }
    }

    public Duration getAgentTimeout() {
        return agentTimeout;
    }

    public void setAgentTimeout(Duration agentTimeout) {
        this.agentTimeout = agentTimeout;
    }

    public Duration getCollaborationDeadline() {
        return collaborationDeadline;
    }

    public void setCollaborationDeadline(Duration collaborationDeadline) {
        this.collaborationDeadline = collaborationDeadline;
    }

    public Duration getMaxCollaborationDeadline() {
        return maxCollaborationDeadline;
    }

    public void setMaxCollaborationDeadline(Duration maxCollaborationDeadline) {
        this.maxCollaborationDeadline = maxCollaborationDeadline;
    }

    public int getWorkerConcurrency() {
        return workerConcurrency;
    }

    public void setWorkerConcurrency(int workerConcurrency) {
        this.workerConcurrency = workerConcurrency;
    }

    public List<String> getDefaultAgents() {
        return defaultAgents;
    }

    public void setDefaultAgents(List<String> defaultAgents) {
        if (defaultAgents == null || defaultAgents.isEmpty()) {
            return;
        }
        this.defaultAgents = new ArrayList<>(defaultAgents);
    }

    public Map<String, AgentDefinition> getAgents() {
        return agents;
    }

    public void setAgents(Map<String, AgentDefinition> agents) {
        if (agents == null) {
            return;
        }
        this.agents = new LinkedHashMap<>(agents);
    }

    public ParadigmConfig getParadigms() {
        return paradigms;
    }

    public void setParadigms(ParadigmConfig paradigms) {
        this.paradigms = paradigms != null ? paradigms : new ParadigmConfig();
    }

    public SessionConfig getSessions() {
        return sessions;
    }

    public void setSessions(SessionConfig sessions) {
        this.sessions = sessions != null ? sessions : new SessionConfig();
    }

    public BridgeConfig getBridge() {
        return bridge;
    }

    public void setBridge(BridgeConfig bridge) {
        this.bridge = bridge != null ? bridge : new BridgeConfig();
    }
}
