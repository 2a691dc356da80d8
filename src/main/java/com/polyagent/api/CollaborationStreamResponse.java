package com.polyagent.api;

import java.time.Instant;

public record CollaborationStreamResponse(
        String sessionId,
        String streamPath,
        Instant acceptedAt
) {
}
