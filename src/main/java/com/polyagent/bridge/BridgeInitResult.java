package com.polyagent.bridge;

import org.springframework.lang.Nullable;

public record BridgeInitResult(
        boolean success,
        @Nullable String error
) {
}
