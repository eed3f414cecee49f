package com.authgate.backend.modules.auth.application;

public record IssuedTokens(String accessToken, String refreshToken) {
}
