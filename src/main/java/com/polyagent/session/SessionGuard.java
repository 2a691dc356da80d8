package com.polyagent.session;

/**
 * Proof of a won {@link SessionManager#begin}. Only the holder may end the run.
 */
public record SessionGuard(
        String sessionId,
        String owner
) {
}
