package com.polyagent.orchestration.paradigm;

import com.polyagent.agent.AgentHandle;
import com.polyagent.orchestration.InvocationScope;
import com.polyagent.orchestration.model.ParadigmPayload;

import java.util.List;

/**
 * One coordination algorithm. Implementations route every agent call through
 * {@link com.polyagent.orchestration.api.AgentInvocationService} and throw
 * {@link com.polyagent.orchestration.CollaborationException} of kind {@code PARADIGM_EXECUTION_ERROR}
 * when too few agents succeed for the paradigm to produce a result.
 */
public interface ParadigmStrategy {

    Paradigm paradigm();

    ParadigmPayload run(InvocationScope scope, String task, List<AgentHandle> agents);
}
