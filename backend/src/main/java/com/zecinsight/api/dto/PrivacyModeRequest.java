package com.zecinsight.api.dto;

import jakarta.validation.constraints.NotBlank;

public record PrivacyModeRequest(
        @NotBlank(message = "privacy_mode is required")
        String privacyMode
) {
}
