package com.authgate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record OpaqueTokenValidationResponse(
        boolean valid,
        UUID userId,
        String email,
        String tokenType,
        OffsetDateTime expiresAt
) {
}
