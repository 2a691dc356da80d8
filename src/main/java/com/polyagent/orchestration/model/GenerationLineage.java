package com.polyagent.orchestration.model;

import java.util.List;

public record GenerationLineage(
        int generation,
        List<ScoredOutput> retained,
        List<ScoredOutput> discarded
) {
    public record ScoredOutput(String agentId, String response, double score) {
    }
}
