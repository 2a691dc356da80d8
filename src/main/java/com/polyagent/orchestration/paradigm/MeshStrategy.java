package com.polyagent.orchestration.paradigm;

import static com.polyagent.orchestration.OrchestrationConstants.PURPOSE_MESH_TURN;

import com.polyagent.agent.AgentHandle;
import com.polyagent.config.PolyAgentProperties;
import com.polyagent.orchestration.InvocationScope;
import com.polyagent.orchestration.api.AgentInvocationService;
import com.polyagent.orchestration.model.AgentInvocationResult;
import com.polyagent.orchestration.model.MeshPayload;
import com.polyagent.orchestration.model.MeshTurn;
import com.polyagent.orchestration.model.ParadigmPayload;
import com.polyagent.orchestration.service.CollaborationContextService;
import com.polyagent.orchestration.service.ParadigmPromptService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Sequential ring conversation. Each turn sees the whole transcript so far, across rounds.
 * Failed turns are skipped; a round in which nobody answers ends the collaboration.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MeshStrategy implements ParadigmStrategy {

    private final AgentInvocationService invocationService;
    private final ParadigmPromptService promptService;
    private final CollaborationContextService contextService;
    private final PolyAgentProperties properties;

    @Override
    public Paradigm paradigm() {
        return Paradigm.MESH;
    }

    @Override
    public ParadigmPayload run(InvocationScope scope, String task, List<AgentHandle> agents) {
        int rounds = properties.getParadigms().getMeshRounds();
        List<MeshTurn> turns = new ArrayList<>();
        Set<String> failedAgents = new LinkedHashSet<>();
        if (agents.isEmpty()) {
            return new MeshPayload(rounds, List.of(), "", List.of());
        }
        for (int round = 1; round <= rounds; round++) {
            String roundTask = promptService.meshTurnTask(task, round);
            int answered = 0;
            for (AgentHandle agent : agents) {
                String transcript = contextService.buildTranscript(turns);
                AgentInvocationResult result = invocationService.invoke(scope, agent, roundTask,
                        StringUtils.hasText(transcript) ? transcript : null, PURPOSE_MESH_TURN);
                if (result.succeeded()) {
                    turns.add(new MeshTurn(agent.id(), round, result.output()));
                    answered++;
                } else {
                    failedAgents.add(agent.id());
                }
            }
            if (answered == 0) {
                throw ParadigmFailures.noSurvivors(scope, paradigm(), "round " + round, failedAgents);
            }
            log.debug("Mesh round {} of session {} finished with {} of {} turns.", round, scope.sessionId(),
                    answered, agents.size());
        }
        return new MeshPayload(rounds, List.copyOf(turns), contextService.buildTranscript(turns),
                List.copyOf(failedAgents));
    }
}
