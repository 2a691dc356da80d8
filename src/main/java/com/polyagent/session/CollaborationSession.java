package com.polyagent.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.model.CollaborationResult;
import com.polyagent.orchestration.paradigm.Paradigm;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of one session. The session manager replaces snapshots atomically per id.
 */
public record CollaborationSession(
        String id,
        SessionState state,
        @Nullable Paradigm paradigm,
        @Nullable String task,
        List<String> agents,
        @Nullable CollaborationResult result,
        @Nullable CollaborationErrorKind errorKind,
        @Nullable String errorMessage,
        Instant createdAt,
        @Nullable Instant startedAt,
        @Nullable Instant endedAt,
        @JsonIgnore @Nullable String owner
) {
    public CollaborationSession {
        agents = agents != null ? List.copyOf(agents) : List.of();
    }

    static CollaborationSession idle(String id, @Nullable Paradigm paradigm, List<String> agents) {
        return new CollaborationSession(id, SessionState.IDLE, paradigm, null, agents, null, null, null,
                Instant.now(), null, null, null);
    }

    CollaborationSession running(Paradigm paradigm, String task, List<String> agents, String owner) {
        return new CollaborationSession(id, SessionState.RUNNING, paradigm, task, agents, null, null, null,
                createdAt, Instant.now(), null, owner);
    }

    CollaborationSession completed(CollaborationResult result) {
        return new CollaborationSession(id, SessionState.COMPLETED, paradigm, task, agents, result, null, null,
                createdAt, startedAt, Instant.now(), null);
    }

    CollaborationSession failed(CollaborationErrorKind kind, String message) {
        return new CollaborationSession(id, SessionState.FAILED, paradigm, task, agents, null, kind, message,
                createdAt, startedAt, Instant.now(), null);
    }
}
