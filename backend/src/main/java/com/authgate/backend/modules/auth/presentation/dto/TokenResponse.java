package com.authgate.backend.modules.auth.presentation.dto;

public record TokenResponse(String accessToken, String refreshToken, String tokenType) {

    public static final String DEFAULT_TOKEN_TYPE = "bearer";

    public static TokenResponse bearer(String accessToken, String refreshToken) {
        return new TokenResponse(accessToken, refreshToken, DEFAULT_TOKEN_TYPE);
    }
}
