package com.polyagent.orchestration.model;

import com.polyagent.orchestration.CollaborationErrorKind;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;

public record InvocationRecord(
        String agentId,
        Instant startedAt,
        Instant endedAt,
        boolean success,
        @Nullable CollaborationErrorKind errorKind,
        @Nullable String errorMessage
) {
    public static InvocationRecord succeeded(String agentId, Instant startedAt, Instant endedAt) {
        return new InvocationRecord(agentId, startedAt, endedAt, true, null, null);
    }

    public static InvocationRecord failed(String agentId, Instant startedAt, Instant endedAt,
                                          CollaborationErrorKind errorKind, @Nullable String errorMessage) {
        return new InvocationRecord(agentId, startedAt, endedAt, false, errorKind, errorMessage);
    }

    public Duration duration() {
        return Duration.between(startedAt, endedAt);
    }
}
