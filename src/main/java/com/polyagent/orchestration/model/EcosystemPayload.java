package com.polyagent.orchestration.model;

import java.util.List;

public record EcosystemPayload(
        String emergentSynthesis,
        List<GenerationLineage> lineage,
        List<String> failedAgents
) implements ParadigmPayload {

    @Override
    public String summaryText() {
        return emergentSynthesis;
    }
}
