package com.polyagent.bridge;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Outcome of a direct bridge task (analysis, optimization, debugging). {@code result} is the bridge's body.
 */
public record BridgeTaskResult(
        boolean success,
        @Nullable Map<String, Object> result,
        @Nullable String error
) {
    public static BridgeTaskResult failed(String error) {
        return new BridgeTaskResult(false, null, error);
    }
}
