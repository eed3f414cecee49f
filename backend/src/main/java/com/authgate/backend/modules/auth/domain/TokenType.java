package com.authgate.backend.modules.auth.domain;

import java.util.Arrays;
import java.util.Optional;

public enum TokenType {

    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    /**
     * Value written to the {@code type} claim of a JWT and reported by opaque introspection.
     */
    public String claimValue() {
        return claimValue;
    }

    public static Optional<TokenType> fromClaim(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.claimValue.equals(value.toString()))
                .findFirst();
    }
}
