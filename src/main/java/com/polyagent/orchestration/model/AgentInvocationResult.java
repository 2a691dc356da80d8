package com.polyagent.orchestration.model;

import org.springframework.lang.Nullable;

public record AgentInvocationResult(
        String agentId,
        @Nullable String output,
        InvocationRecord record
) {
    public boolean succeeded() {
        return record.success();
    }
}
