package com.polyagent.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;

public record DebugCodeRequest(
        @NotBlank String code,
        @NotBlank @JsonAlias("error_message") String errorMessage,
        String language
) {
}
