package com.authgate.backend.support;

import java.time.Duration;

import com.authgate.backend.global.config.AuthProperties;

public final class TestAuthProperties {

    public static final String SECRET = "unit-test-signing-secret-that-is-long-enough-for-hs512-0123456789";

    private TestAuthProperties() {
    }

    public static AuthProperties defaults() {
        return with(SECRET, "HS256", Duration.ofMinutes(30), Duration.ofDays(7));
    }

    public static AuthProperties with(String secret, String algorithm, Duration accessTtl, Duration refreshTtl) {
        return new AuthProperties(
                new AuthProperties.Jwt(secret, algorithm),
                new AuthProperties.Token(accessTtl, refreshTtl),
                new AuthProperties.Password(4, 4)
        );
    }
}
