package com.polyagent.orchestration.paradigm;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ParadigmStrategyService {

    private final OrchestraStrategy orchestraStrategy;
    private final MeshStrategy meshStrategy;
    private final SwarmStrategy swarmStrategy;
    private final WeaverStrategy weaverStrategy;
    private final EcosystemStrategy ecosystemStrategy;

    public ParadigmStrategy strategyFor(Paradigm paradigm) {
        return switch (paradigm) {
            case ORCHESTRA -> orchestraStrategy;
            case MESH -> meshStrategy;
            case SWARM -> swarmStrategy;
            case WEAVER -> weaverStrategy;
            case ECOSYSTEM -> ecosystemStrategy;
        };
    }
}
