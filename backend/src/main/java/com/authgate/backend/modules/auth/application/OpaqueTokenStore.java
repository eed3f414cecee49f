package com.authgate.backend.modules.auth.application;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.authgate.backend.global.config.AuthProperties;
import com.authgate.backend.modules.auth.domain.OpaqueToken;
import com.authgate.backend.modules.auth.domain.TokenType;
import com.authgate.backend.modules.auth.domain.UserAccount;
import com.authgate.backend.modules.auth.infrastructure.persistence.OpaqueTokenRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Server-side random tokens. The string carries no information; everything about it lives in
 * the {@code opaque_token} row.
 */
@Component
@Transactional
public class OpaqueTokenStore implements TokenStore<OpaqueToken> {

    static final int TOKEN_BYTES = 32;

    private static final Base64.Encoder TOKEN_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final OpaqueTokenRepository opaqueTokenRepository;
    private final AuthProperties properties;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public OpaqueTokenStore(OpaqueTokenRepository opaqueTokenRepository, AuthProperties properties, Clock clock) {
        this.opaqueTokenRepository = opaqueTokenRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "opaque_token";
    }

    /**
     * 256 random bits, base64url without padding (43 characters).
     */
    public String generate() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return TOKEN_ENCODER.encodeToString(bytes);
    }

    public OpaqueToken issue(UserAccount user, TokenType tokenType) {
        return issue(user, tokenType, defaultTtl(tokenType));
    }

    public OpaqueToken issue(UserAccount user, TokenType tokenType, Duration ttl) {
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plus(ttl);
        return opaqueTokenRepository.save(new OpaqueToken(user, generate(), tokenType, expiresAt));
    }

    /**
     * Successful lookups stamp {@code last_used_at}.
     */
    @Override
    public Optional<OpaqueToken> validate(String token, TokenType tokenType) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Optional<OpaqueToken> active = tokenType == null
                ? opaqueTokenRepository.findActiveByToken(token)
                : opaqueTokenRepository.findActiveByTokenAndType(token, tokenType);
        Optional<OpaqueToken> found = active
                .filter(opaqueToken -> !opaqueToken.isExpiredAt(now));
        found.ifPresent(opaqueToken -> opaqueTokenRepository.touchLastUsed(opaqueToken.getId(), now));
        return found;
    }

    @Override
    public boolean consume(String token, TokenType tokenType) {
        Objects.requireNonNull(tokenType, "tokenType");
        return opaqueTokenRepository.consumeByToken(token, tokenType) == 1;
    }

    @Override
    public boolean revoke(String token) {
        return opaqueTokenRepository.revokeByToken(token) > 0;
    }

    @Override
    public int revokeAllForUser(UUID userId, TokenType tokenType) {
        return tokenType == null
                ? opaqueTokenRepository.revokeAllByUserId(userId)
                : opaqueTokenRepository.revokeAllByUserIdAndType(userId, tokenType);
    }

    @Override
    public int cleanupExpired() {
        return opaqueTokenRepository.deleteExpired(OffsetDateTime.now(clock));
    }

    Duration defaultTtl(TokenType tokenType) {
        return tokenType == TokenType.ACCESS
                ? properties.token().accessTtl()
                : properties.token().refreshTtl();
    }
}
