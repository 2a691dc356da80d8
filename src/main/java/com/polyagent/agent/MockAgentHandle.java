package com.polyagent.agent;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Deterministic offline agent for demos and local runs without provider keys.
 */
public class MockAgentHandle implements AgentHandle {

    private static final int PREVIEW_LENGTH = 80;

    private final String id;
    private final int priority;

    public MockAgentHandle(String id, int priority) {
        this.id = id;
        this.priority = priority;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public AgentResponse invoke(String task, @Nullable String context) {
        StringBuilder sb = new StringBuilder();
        sb.append("Mock response from ").append(id).append(": ").append(preview(task));
        if (StringUtils.hasText(context)) {
            sb.append("\nBuilding on context: ").append(preview(context));
        }
        return new AgentResponse(id, sb.toString());
    }

    private static String preview(String text) {
        String normalized = text.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= PREVIEW_LENGTH) {
            return normalized;
        }
        return normalized.substring(0, PREVIEW_LENGTH) + "...";
    }
}
