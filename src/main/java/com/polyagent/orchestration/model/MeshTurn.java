package com.polyagent.orchestration.model;

public record MeshTurn(
        String agentId,
        int round,
        String response
) {
}
