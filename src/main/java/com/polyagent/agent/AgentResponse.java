package com.polyagent.agent;

public record AgentResponse(
        String agentId,
        String response
) {
}
