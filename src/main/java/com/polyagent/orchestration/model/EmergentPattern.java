package com.polyagent.orchestration.model;

import java.util.List;

/**
 * A theme shared by the responses of two or more agents.
 */
public record EmergentPattern(
        String theme,
        List<String> agents
) {
    public int support() {
        return agents.size();
    }
}
