package com.polyagent.orchestration.model;

import com.polyagent.orchestration.paradigm.Paradigm;

import java.time.Instant;
import java.util.List;

/**
 * Immutable outcome of one collaboration. Owned by its session until the session is evicted.
 */
public record CollaborationResult(
        String sessionId,
        Paradigm paradigm,
        String task,
        List<String> agents,
        ParadigmPayload payload,
        Instant startedAt,
        Instant completedAt
) {
    public CollaborationResult {
        agents = List.copyOf(agents);
    }
}
