package com.authgate.backend.global.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

/**
 * Process-wide authentication settings, bound once at startup from the {@code auth.*} keys.
 * Instances are immutable; components receive the record through their constructors.
 */
@Validated
@ConfigurationProperties(prefix = "auth")
public record AuthProperties(
        @Valid @NotNull Jwt jwt,
        @Valid @NotNull @DefaultValue Token token,
        @Valid @NotNull @DefaultValue Password password
) {

    public record Jwt(
            @NotBlank String secret,
            @NotBlank @DefaultValue("HS256") String algorithm
    ) {
    }

    /**
     * Lifetimes shared by both token modes. Bare numbers are read as minutes for access tokens
     * and days for refresh tokens.
     */
    public record Token(
            @NotNull @DurationUnit(ChronoUnit.MINUTES) @DefaultValue("30") Duration accessTtl,
            @NotNull @DurationUnit(ChronoUnit.DAYS) @DefaultValue("7") Duration refreshTtl
    ) {
    }

    public record Password(
            @Min(1) @DefaultValue("4") int minLength,
            @Min(4) @Max(31) @DefaultValue("12") int bcryptStrength
    ) {
    }
}
