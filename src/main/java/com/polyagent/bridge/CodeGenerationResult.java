package com.polyagent.bridge;

import com.polyagent.orchestration.model.CollaborationResult;
import org.springframework.lang.Nullable;

/**
 * Outcome of a bridge-augmented generation. {@code collaboration} holds the plain strategy result
 * whenever the collaboration itself succeeded, even if the bridge did not.
 */
public record CodeGenerationResult(
        boolean success,
        @Nullable String code,
        @Nullable String error,
        boolean bridgeAvailable,
        @Nullable CollaborationResult collaboration
) {
}
