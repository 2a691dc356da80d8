package com.polyagent.api;

import jakarta.validation.constraints.NotBlank;

public record GenerateCodeRequest(
        @NotBlank String prompt,
        String language,
        String paradigm
) {
}
