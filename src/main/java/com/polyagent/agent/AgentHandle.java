package com.polyagent.agent;

import org.springframework.lang.Nullable;

/**
 * Uniform invocation contract for one configured agent.
 * Handles are borrowed by the orchestrator for the duration of a single collaboration.
 */
public interface AgentHandle {

    String id();

    /**
     * Preference when a paradigm has to elect a lead agent; higher wins.
     */
    default int priority() {
        return 0;
    }

    AgentResponse invoke(String task, @Nullable String context) throws AgentException;
}
