package com.polyagent.orchestration.service;

import com.polyagent.orchestration.model.AgentInvocationResult;
import com.polyagent.orchestration.model.MeshTurn;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class CollaborationContextService {

    public String buildResultsContext(List<AgentInvocationResult> results) {
        if (results == null || results.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (AgentInvocationResult result : results) {
            if (!result.succeeded()) {
                continue;
            }
            sb.append("[").append(result.agentId()).append("]\n");
            sb.append(result.output()).append("\n\n");
        }
        return sb.toString().trim();
    }

    public String buildTranscript(List<MeshTurn> turns) {
        if (turns == null || turns.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (MeshTurn turn : turns) {
            sb.append("[").append(turn.agentId()).append(" - round ").append(turn.round()).append("]\n");
            sb.append(turn.response()).append("\n\n");
        }
        return sb.toString().trim();
    }
}
