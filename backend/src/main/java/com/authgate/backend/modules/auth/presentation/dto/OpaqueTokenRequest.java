package com.authgate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Opaque-mode refresh, logout and validation body.
 */
public record OpaqueTokenRequest(@NotBlank(message = "token is required") String token) {
}
