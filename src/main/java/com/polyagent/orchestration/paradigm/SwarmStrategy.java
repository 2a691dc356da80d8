package com.polyagent.orchestration.paradigm;

import static com.polyagent.orchestration.OrchestrationConstants.PURPOSE_SWARM;

import com.polyagent.agent.AgentHandle;
import com.polyagent.orchestration.InvocationScope;
import com.polyagent.orchestration.api.AgentInvocationService;
import com.polyagent.orchestration.model.AgentContribution;
import com.polyagent.orchestration.model.AgentInvocationResult;
import com.polyagent.orchestration.model.ParadigmPayload;
import com.polyagent.orchestration.model.SwarmPayload;
import com.polyagent.orchestration.service.ParadigmPromptService;
import com.polyagent.orchestration.service.ResponseAnalysisService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * All agents work the same task at once with no shared context. Themes found in two or more
 * responses become emergent patterns.
 */
@Component
@RequiredArgsConstructor
public class SwarmStrategy implements ParadigmStrategy {

    private final AgentInvocationService invocationService;
    private final ParadigmPromptService promptService;
    private final ResponseAnalysisService analysisService;

    @Override
    public Paradigm paradigm() {
        return Paradigm.SWARM;
    }

    @Override
    public ParadigmPayload run(InvocationScope scope, String task, List<AgentHandle> agents) {
        if (agents.isEmpty()) {
            return new SwarmPayload(List.of(), List.of(), List.of());
        }
        List<AgentInvocationResult> results = invocationService.invokeAll(scope, agents,
                promptService.swarmTask(task), null, PURPOSE_SWARM);
        Set<String> failedAgents = new LinkedHashSet<>();
        ParadigmFailures.collect(results, failedAgents);
        List<AgentContribution> responses = ParadigmFailures.successes(results).stream()
                .map(AgentContribution::from)
                .toList();
        if (responses.isEmpty()) {
            throw ParadigmFailures.noSurvivors(scope, paradigm(), "the swarm pass", failedAgents);
        }
        return new SwarmPayload(responses, analysisService.sharedThemes(responses), List.copyOf(failedAgents));
    }
}
