package com.polyagent.api;

import jakarta.validation.constraints.NotBlank;

public record CodeTaskRequest(
        @NotBlank String code,
        String language
) {
}
