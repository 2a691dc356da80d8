package com.polyagent.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String kind,
        String message,
        String sessionId,
        boolean retryable
) {
}
