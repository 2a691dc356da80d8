package com.polyagent.bridge;

import org.springframework.lang.Nullable;

import java.time.Instant;

public record BridgeStatus(
        BridgeState status,
        boolean enabled,
        @Nullable String lastError,
        @Nullable Instant lastCheckedAt
) {
}
