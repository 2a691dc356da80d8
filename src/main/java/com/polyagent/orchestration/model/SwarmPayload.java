package com.polyagent.orchestration.model;

import java.util.List;
import java.util.stream.Collectors;

public record SwarmPayload(
        List<AgentContribution> responses,
        List<EmergentPattern> emergentPatterns,
        List<String> failedAgents
) implements ParadigmPayload {

    @Override
    public String summaryText() {
        return responses.stream()
                .map(response -> "[" + response.agentId() + "]\n" + response.response())
                .collect(Collectors.joining("\n\n"));
    }
}
