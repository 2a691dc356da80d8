package com.polyagent.orchestration.model;

import java.util.List;

public record MeshPayload(
        int rounds,
        List<MeshTurn> conversations,
        String finalContext,
        List<String> failedAgents
) implements ParadigmPayload {

    @Override
    public String summaryText() {
        return finalContext;
    }
}
