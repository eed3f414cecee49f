package com.authgate.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Read view shared by both persisted token ledgers.
 */
public interface StoredToken {

    UUID getUserId();

    String getToken();

    TokenType getTokenType();

    OffsetDateTime getExpiresAt();

    boolean isRevoked();

    default boolean isExpiredAt(OffsetDateTime now) {
        return getExpiresAt().isBefore(now);
    }
}
