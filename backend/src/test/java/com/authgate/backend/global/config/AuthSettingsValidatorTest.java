package com.authgate.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import com.authgate.backend.support.TestAuthProperties;

import org.junit.jupiter.api.Test;

class AuthSettingsValidatorTest {

    @Test
    void acceptsSoundSettings() {
        assertThat(new AuthSettingsValidator(TestAuthProperties.defaults()).validate()).isEmpty();
    }

    @Test
    void rejectsShippedPlaceholderSecret() {
        AuthSettingsValidator validator = validator(AuthSettingsValidator.PLACEHOLDER_SECRET, "HS256");

        assertThat(validator.validate()).anyMatch(problem -> problem.contains("placeholder"));
        assertThatThrownBy(validator::validateOnStartup).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsSecretTooShortForAlgorithm() {
        String secret32 = "0123456789-0123456789-0123456789";

        assertThat(validator(secret32, "HS256").validate()).isEmpty();
        assertThat(validator(secret32, "HS512").validate()).anyMatch(problem -> problem.contains("512 bits"));
        assertThat(validator("too-short", "HS256").validate()).isNotEmpty();
    }

    @Test
    void rejectsUnknownAlgorithm() {
        assertThat(validator(TestAuthProperties.SECRET, "RS256").validate())
                .anyMatch(problem -> problem.startsWith("auth.jwt.algorithm"));
    }

    @Test
    void refreshLifetimeMustExceedAccessLifetime() {
        AuthSettingsValidator validator = new AuthSettingsValidator(TestAuthProperties.with(
                TestAuthProperties.SECRET, "HS256", Duration.ofHours(2), Duration.ofHours(1)));

        assertThat(validator.validate()).anyMatch(problem -> problem.startsWith("auth.token.refresh-ttl"));
    }

    private static AuthSettingsValidator validator(String secret, String algorithm) {
        return new AuthSettingsValidator(TestAuthProperties.with(secret, algorithm, Duration.ofMinutes(30), Duration.ofDays(7)));
    }
}
