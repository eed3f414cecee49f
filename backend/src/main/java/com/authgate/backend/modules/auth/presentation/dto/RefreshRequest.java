package com.authgate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * JWT-mode refresh and logout body.
 */
public record RefreshRequest(@NotBlank(message = "refresh_token is required") String refreshToken) {
}
