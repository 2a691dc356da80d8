package com.polyagent.orchestration.model;

public record AgentContribution(
        String agentId,
        String response
) {
    public static AgentContribution from(AgentInvocationResult result) {
        return new AgentContribution(result.agentId(), result.output());
    }
}
