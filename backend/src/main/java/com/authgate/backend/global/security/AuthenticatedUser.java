package com.authgate.backend.global.security;

import java.util.UUID;

import com.authgate.backend.modules.auth.domain.TokenMode;
import com.authgate.backend.modules.auth.presentation.dto.UserResponse;

/**
 * Principal placed in the security context once a bearer token has been resolved to an active
 * account.
 */
public record AuthenticatedUser(UUID userId, String email, TokenMode mode, UserResponse user) {
}
