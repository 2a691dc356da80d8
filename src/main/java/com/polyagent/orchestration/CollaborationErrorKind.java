package com.polyagent.orchestration;

import org.springframework.http.HttpStatus;

/**
 * Stable, machine-readable failure kinds surfaced to callers of the orchestrator.
 */
public enum CollaborationErrorKind {
    UNKNOWN_PARADIGM(false, HttpStatus.BAD_REQUEST),
    NO_AGENTS(false, HttpStatus.BAD_REQUEST),
    INVALID_REQUEST(false, HttpStatus.BAD_REQUEST),
    UNKNOWN_AGENT(false, HttpStatus.NOT_FOUND),
    SESSION_NOT_FOUND(false, HttpStatus.NOT_FOUND),
    SESSION_BUSY(true, HttpStatus.CONFLICT),
    SESSION_CLOSED(false, HttpStatus.CONFLICT),
    AGENT_ERROR(true, HttpStatus.BAD_GATEWAY),
    PARADIGM_EXECUTION_ERROR(false, HttpStatus.INTERNAL_SERVER_ERROR),
    TIMEOUT(true, HttpStatus.GATEWAY_TIMEOUT),
    CANCELLED(true, HttpStatus.CONFLICT),
    BRIDGE_UNAVAILABLE(true, HttpStatus.SERVICE_UNAVAILABLE);

    private final boolean retryable;
    private final HttpStatus status;

    CollaborationErrorKind(boolean retryable, HttpStatus status) {
        this.retryable = retryable;
        this.status = status;
    }

    public boolean retryable() {
        return retryable;
    }

    public HttpStatus status() {
        return status;
    }
}
