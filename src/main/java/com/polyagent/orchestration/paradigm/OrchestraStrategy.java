package com.polyagent.orchestration.paradigm;

import static com.polyagent.orchestration.OrchestrationConstants.PURPOSE_CONDUCTOR;
import static com.polyagent.orchestration.OrchestrationConstants.PURPOSE_CONTRIBUTION;

import com.polyagent.agent.AgentHandle;
import com.polyagent.orchestration.InvocationScope;
import com.polyagent.orchestration.api.AgentInvocationService;
import com.polyagent.orchestration.model.AgentContribution;
import com.polyagent.orchestration.model.AgentInvocationResult;
import com.polyagent.orchestration.model.OrchestraPayload;
import com.polyagent.orchestration.model.ParadigmPayload;
import com.polyagent.orchestration.service.ParadigmPromptService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Elects the highest-priority agent as conductor (request order breaks ties), then hands its guidance to
 * every other agent. A failed conductor is replaced by the next candidate; failed members are skipped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OrchestraStrategy implements ParadigmStrategy {

    private final AgentInvocationService invocationService;
    private final ParadigmPromptService promptService;

    @Override
    public Paradigm paradigm() {
        return Paradigm.ORCHESTRA;
    }

    @Override
    public ParadigmPayload run(InvocationScope scope, String task, List<AgentHandle> agents) {
        Set<String> failedAgents = new LinkedHashSet<>();
        if (agents.isEmpty()) {
            return new OrchestraPayload(null, "", List.of(), List.of());
        }
        List<String> agentIds = agents.stream().map(AgentHandle::id).toList();
        // List.sort is stable, so equal priorities keep request order
        List<AgentHandle> candidates = new ArrayList<>(agents);
        candidates.sort(Comparator.comparingInt(AgentHandle::priority).reversed());

        AgentHandle conductor = null;
        String guidance = null;
        String conductorTask = promptService.conductorTask(task, agentIds);
        for (AgentHandle candidate : candidates) {
            AgentInvocationResult result = invocationService.invoke(scope, candidate, conductorTask, null, PURPOSE_CONDUCTOR);
            if (result.succeeded()) {
                conductor = candidate;
                guidance = result.output();
                break;
            }
            failedAgents.add(candidate.id());
            log.warn("Conductor candidate {} failed for session {}; electing the next candidate.",
                    candidate.id(), scope.sessionId());
        }
        if (conductor == null) {
            throw ParadigmFailures.noSurvivors(scope, paradigm(), "conductor election", failedAgents);
        }
        log.info("Agent {} conducts session {}.", conductor.id(), scope.sessionId());

        String conductorId = conductor.id();
        List<AgentHandle> members = agents.stream()
                .filter(agent -> !agent.id().equals(conductorId) && !failedAgents.contains(agent.id()))
                .toList();
        String memberContext = "Conductor guidance from " + conductorId + ":\n" + guidance;
        List<AgentContribution> contributions = new ArrayList<>();
        if (!members.isEmpty()) {
            List<AgentInvocationResult> results = invocationService.invokeAll(scope, members,
                    member -> promptService.orchestraMemberTask(task, member.id()),
                    member -> memberContext,
                    PURPOSE_CONTRIBUTION);
            contributions.addAll(ParadigmFailures.successes(results).stream().map(AgentContribution::from).toList());
            ParadigmFailures.collect(results, failedAgents);
        }
        return new OrchestraPayload(conductorId, guidance, List.copyOf(contributions), List.copyOf(failedAgents));
    }
}
