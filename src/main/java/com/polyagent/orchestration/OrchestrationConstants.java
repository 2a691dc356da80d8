package com.polyagent.orchestration;

import java.util.Set;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // Stream event types
    public static final String EVENT_SESSION_START = "session-start";
    public static final String EVENT_AGENT_RESULT = "agent-result";
    public static final String EVENT_SESSION_COMPLETE = "session-complete";
    public static final String EVENT_ERROR = "error";
    public static final Set<String> TERMINAL_EVENTS = Set.of(EVENT_SESSION_COMPLETE, EVENT_ERROR);

    // Invocation purposes, used in logs and metrics tags
    public static final String PURPOSE_CONDUCTOR = "conductor";
    public static final String PURPOSE_CONTRIBUTION = "contribution";
    public static final String PURPOSE_MESH_TURN = "mesh-turn";
    public static final String PURPOSE_SWARM = "swarm";
    public static final String PURPOSE_WEAVER_ANALYSIS = "weaver-analysis";
    public static final String PURPOSE_WEAVER_REFINE = "weaver-refine";
    public static final String PURPOSE_ECOSYSTEM = "ecosystem";

    public static final String BRIDGE_SESSION_PREFIX = "bridge-";
    public static final String NO_CONTEXT = "None.";

    // Agent-side prompts
    public static final String AGENT_SYSTEM_PROMPT = """
            You are %s, one of several AI agents collaborating on a shared software task.
            Be concise and practical. Build on the context you are given instead of repeating it.
            If assumptions are required, list them explicitly.
            """;

    public static final String AGENT_USER_TEMPLATE = """
            Task:
            {task}

            Context:
            {context}
            """;

    // Paradigm task templates
    public static final String CONDUCTOR_TASK = """
            As the conductor of a multi-agent orchestra, analyze this task and assign roles.
            Task: %s
            Available agents: %s

            Provide role assignments and a coordination strategy the other agents will follow.
            """;

    public static final String ORCHESTRA_MEMBER_TASK = """
            You are part of a multi-agent orchestra working on: %s
            Your role: specialized %s agent.
            Follow the conductor's guidance given in the context and provide your contribution.
            """;

    public static final String MESH_TURN_TASK = """
            Continuing our collaborative conversation about: %s
            Round %d: contribute to the discussion, building on what has been said so far.
            Focus on natural dialogue and collaborative problem-solving.
            """;

    public static final String SWARM_TASK = """
            You are an autonomous agent in a code swarm working on: %s
            Operate independently and contribute your unique perspective.
            Provide practical, actionable solutions.
            """;

    public static final String WEAVER_ANALYSIS_TASK = """
            Analyze the contextual dimensions of this task: %s
            Consider technical, business and user context, environmental constraints and integration requirements.
            """;

    public static final String WEAVER_REFINE_TASK = """
            As a contextual code weaver, create a solution for: %s
            Integrate the combined contextual analysis given in the context into a cohesive solution.
            """;

    public static final String ECOSYSTEM_TASK = """
            You are a species in an emergent code ecosystem.
            Environment: %s
            Generation: %d

            Evolve and adapt your approach based on the surviving approaches given in the context.
            """;

    // Bridge augmentation
    public static final String BRIDGE_UNAVAILABLE_MESSAGE = "Bridge services unavailable";
    public static final String BRIDGE_NOT_CONFIGURED_MESSAGE = "Bridge gateway is not enabled";
}
