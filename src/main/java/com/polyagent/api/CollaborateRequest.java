package com.polyagent.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Body of a collaboration request. A missing {@code agents} list falls back to the configured default agents;
 * an empty one is rejected.
 */
public record CollaborateRequest(
        @NotBlank String sessionId,
        @NotBlank String paradigm,
        @NotBlank String task,
        List<String> agents,
        @Positive Long deadlineSeconds
) {
}
