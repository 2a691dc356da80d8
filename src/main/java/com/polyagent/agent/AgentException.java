package com.polyagent.agent;

/**
 * Failure reported by a single agent; the active paradigm decides whether it is tolerated.
 */
public class AgentException extends Exception {

    private final String agentId;

    public AgentException(String agentId, String message) {
        super(message);
        this.agentId = agentId;
    }

    public AgentException(String agentId, String message, Throwable cause) {
        super(message, cause);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
