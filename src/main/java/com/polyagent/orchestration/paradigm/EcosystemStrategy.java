package com.polyagent.orchestration.paradigm;

import static com.polyagent.orchestration.OrchestrationConstants.PURPOSE_ECOSYSTEM;

import com.polyagent.agent.AgentHandle;
import com.polyagent.config.PolyAgentProperties;
import com.polyagent.orchestration.InvocationScope;
import com.polyagent.orchestration.api.AgentInvocationService;
import com.polyagent.orchestration.model.AgentInvocationResult;
import com.polyagent.orchestration.model.EcosystemPayload;
import com.polyagent.orchestration.model.GenerationLineage;
import com.polyagent.orchestration.model.GenerationLineage.ScoredOutput;
import com.polyagent.orchestration.model.ParadigmPayload;
import com.polyagent.orchestration.service.ParadigmPromptService;
import com.polyagent.orchestration.service.ResponseAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Agents evolve answers over a fixed number of generations. Outputs scoring at or above the
 * generation mean survive and seed the next generation; the rest are discarded.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EcosystemStrategy implements ParadigmStrategy {

    private static final double SCORE_TOLERANCE = 1e-9;

    private final AgentInvocationService invocationService;
    private final ParadigmPromptService promptService;
    private final ResponseAnalysisService analysisService;
    private final PolyAgentProperties properties;

    @Override
    public Paradigm paradigm() {
        return Paradigm.ECOSYSTEM;
    }

    @Override
    public ParadigmPayload run(InvocationScope scope, String task, List<AgentHandle> agents) {
        if (agents.isEmpty()) {
            return new EcosystemPayload("", List.of(), List.of());
        }
        int generations = properties.getParadigms().getEcosystemGenerations();
        Set<String> failedAgents = new LinkedHashSet<>();
        List<GenerationLineage> lineage = new ArrayList<>();
        List<ScoredOutput> survivors = List.of();

        for (int generation = 1; generation <= generations; generation++) {
            String seed = survivors.isEmpty() ? null : seedContext(survivors);
            List<AgentInvocationResult> results = invocationService.invokeAll(scope, agents,
                    promptService.ecosystemTask(task, generation), seed, PURPOSE_ECOSYSTEM);
            ParadigmFailures.collect(results, failedAgents);
            List<ScoredOutput> scored = ParadigmFailures.successes(results).stream()
                    .map(result -> new ScoredOutput(result.agentId(), result.output(),
                            analysisService.score(result.output(), task)))
                    .toList();
            if (scored.isEmpty()) {
                throw ParadigmFailures.noSurvivors(scope, paradigm(), "generation " + generation, failedAgents);
            }
            double threshold = scored.stream().mapToDouble(ScoredOutput::score).average().orElse(0.0) - SCORE_TOLERANCE;
            List<ScoredOutput> retained = scored.stream().filter(output -> output.score() >= threshold).toList();
            List<ScoredOutput> discarded = scored.stream().filter(output -> output.score() < threshold).toList();
            lineage.add(new GenerationLineage(generation, retained, discarded));
            survivors = retained;
            log.debug("Ecosystem generation {} of session {}: retained={}, discarded={}.", generation,
                    scope.sessionId(), retained.size(), discarded.size());
        }
        return new EcosystemPayload(seedContext(survivors), List.copyOf(lineage), List.copyOf(failedAgents));
    }

    private String seedContext(List<ScoredOutput> survivors) {
        StringBuilder sb = new StringBuilder();
        for (ScoredOutput survivor : survivors) {
            sb.append("[").append(survivor.agentId()).append("]\n");
            sb.append(survivor.response()).append("\n\n");
        }
        return sb.toString().trim();
    }
}
