package com.authgate.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.authgate.backend.modules.auth.domain.StoredToken;
import com.authgate.backend.modules.auth.domain.TokenType;

/**
 * Persisted token ledger. Revocation is one-way and expiry is checked lazily on every lookup.
 *
 * @param <T> row type kept by the ledger
 */
public interface TokenStore<T extends StoredToken> {

    /**
     * Short name used in housekeeping logs.
     */
    String name();

    /**
     * Returns the row only when it exists, is not revoked, matches {@code tokenType} (when given)
     * and has not expired.
     */
    Optional<T> validate(String token, TokenType tokenType);

    /**
     * Atomically revokes a still-active row. Of several concurrent callers at most one gets
     * {@code true}.
     */
    boolean consume(String token, TokenType tokenType);

    /**
     * Marks the row revoked. Returns whether a row with this string exists, including one that was
     * already revoked.
     */
    boolean revoke(String token);

    /**
     * Revokes every active row of the user, optionally limited to one type.
     */
    int revokeAllForUser(UUID userId, TokenType tokenType);

    /**
     * Deletes rows past their expiry, revoked or not.
     */
    int cleanupExpired();
}
