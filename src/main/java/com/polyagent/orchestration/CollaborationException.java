package com.polyagent.orchestration;

import org.springframework.lang.Nullable;

public class CollaborationException extends RuntimeException {

    private final CollaborationErrorKind kind;
    private final String sessionId;

    public CollaborationException(CollaborationErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public CollaborationException(CollaborationErrorKind kind, @Nullable String sessionId, String message) {
        this(kind, sessionId, message, null);
    }

    public CollaborationException(CollaborationErrorKind kind, @Nullable String sessionId, String message,
                                  @Nullable Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.sessionId = sessionId;
    }

    public CollaborationErrorKind getKind() {
        return kind;
    }

    @Nullable
    public String getSessionId() {
        return sessionId;
    }

    public boolean isRetryable() {
        return kind.retryable();
    }
}
