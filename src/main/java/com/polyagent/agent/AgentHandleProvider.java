package com.polyagent.agent;

import com.polyagent.orchestration.CollaborationException;

import java.util.List;

public interface AgentHandleProvider {

    /**
     * Resolves an agent id to a callable handle.
     *
     * @throws CollaborationException of kind {@code UNKNOWN_AGENT} when the id is not registered
     */
    AgentHandle resolve(String agentId);

    boolean isRegistered(String agentId);

    List<AgentDescriptor> describeAgents();
}
