package com.authgate.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.authgate.backend.global.config.AuthProperties;
import com.authgate.backend.modules.auth.domain.RefreshToken;
import com.authgate.backend.modules.auth.domain.TokenType;
import com.authgate.backend.modules.auth.domain.UserAccount;
import com.authgate.backend.modules.auth.infrastructure.persistence.RefreshTokenRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Rotation ledger for JWT-mode refresh tokens. Kept apart from the opaque ledger so a token of
 * one mode can never be redeemed in the other.
 */
@Component
@Transactional
public class RefreshTokenStore implements TokenStore<RefreshToken> {

    private final RefreshTokenRepository refreshTokenRepository;
    private final AuthProperties properties;
    private final Clock clock;

    public RefreshTokenStore(RefreshTokenRepository refreshTokenRepository, AuthProperties properties, Clock clock) {
        this.refreshTokenRepository = refreshTokenRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "refresh_token";
    }

    public RefreshToken create(UserAccount user, String token) {
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plus(properties.token().refreshTtl());
        return refreshTokenRepository.save(new RefreshToken(user, token, expiresAt));
    }

    /**
     * Non-revoked row for the token, expired or not.
     */
    @Transactional(readOnly = true)
    public Optional<RefreshToken> get(String token) {
        return refreshTokenRepository.findActiveByToken(token);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RefreshToken> validate(String token, TokenType tokenType) {
        if (!acceptsType(tokenType)) {
            return Optional.empty();
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        return get(token).filter(refreshToken -> !refreshToken.isExpiredAt(now));
    }

    @Override
    public boolean consume(String token, TokenType tokenType) {
        return acceptsType(tokenType) && refreshTokenRepository.consumeByToken(token) == 1;
    }

    @Override
    public boolean revoke(String token) {
        return refreshTokenRepository.revokeByToken(token) > 0;
    }

    public int revokeAllForUser(UUID userId) {
        return refreshTokenRepository.revokeAllByUserId(userId);
    }

    @Override
    public int revokeAllForUser(UUID userId, TokenType tokenType) {
        return acceptsType(tokenType) ? revokeAllForUser(userId) : 0;
    }

    @Override
    public int cleanupExpired() {
        return refreshTokenRepository.deleteExpired(OffsetDateTime.now(clock));
    }

    private boolean acceptsType(TokenType tokenType) {
        return tokenType == null || tokenType == TokenType.REFRESH;
    }
}
