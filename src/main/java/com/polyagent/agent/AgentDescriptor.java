package com.polyagent.agent;

import java.util.List;

public record AgentDescriptor(
        String id,
        String name,
        String provider,
        String model,
        int priority,
        String description,
        List<String> capabilities
) {
}
