package com.polyagent.orchestration.model;

import java.util.List;

public record WeaverPayload(
        String contextAnalysis,
        List<AgentContribution> refinedResponses,
        String synthesis,
        List<String> failedAgents
) implements ParadigmPayload {

    @Override
    public String summaryText() {
        return synthesis;
    }
}
