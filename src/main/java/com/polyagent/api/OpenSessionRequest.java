package com.polyagent.api;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record OpenSessionRequest(
        @NotBlank String sessionId,
        String paradigm,
        List<String> agents
) {
}
