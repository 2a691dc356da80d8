package com.polyagent.orchestration.model;

import java.util.List;

public record OrchestraPayload(
        String conductorAgent,
        String conductorGuidance,
        List<AgentContribution> contributions,
        List<String> failedAgents
) implements ParadigmPayload {

    @Override
    public String summaryText() {
        StringBuilder sb = new StringBuilder();
        if (conductorGuidance != null && !conductorGuidance.isBlank()) {
            sb.append("[").append(conductorAgent).append(" - conductor]\n").append(conductorGuidance).append("\n\n");
        }
        for (AgentContribution contribution : contributions) {
            sb.append("[").append(contribution.agentId()).append("]\n").append(contribution.response()).append("\n\n");
        }
        return sb.toString().trim();
    }
}
