package com.polyagent.orchestration.paradigm;

import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.CollaborationException;
import com.polyagent.orchestration.InvocationScope;
import com.polyagent.orchestration.model.AgentInvocationResult;

import java.util.Collection;
import java.util.List;
import java.util.Set;

final class ParadigmFailures {

    private ParadigmFailures() {
    }

    static void collect(Collection<AgentInvocationResult> results, Set<String> failedAgents) {
        for (AgentInvocationResult result : results) {
            if (!result.succeeded()) {
                failedAgents.add(result.agentId());
            }
        }
    }

    static List<AgentInvocationResult> successes(List<AgentInvocationResult> results) {
        return results.stream().filter(AgentInvocationResult::succeeded).toList();
    }

    static CollaborationException noSurvivors(InvocationScope scope, Paradigm paradigm, String step,
                                              Collection<String> failedAgents) {
        return new CollaborationException(CollaborationErrorKind.PARADIGM_EXECUTION_ERROR, scope.sessionId(),
                paradigm.id() + " could not continue: no agent succeeded during " + step
                        + " (failed: " + failedAgents + ").");
    }
}
