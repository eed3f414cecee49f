package com.authgate.backend.modules.auth.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.authgate.backend.global.error.ProblemCode;
import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.auth.domain.RefreshToken;
import com.authgate.backend.modules.auth.domain.TokenMode;
import com.authgate.backend.modules.auth.domain.TokenType;
import com.authgate.backend.modules.auth.domain.UserAccount;

import io.jsonwebtoken.Claims;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stateless access tokens, refresh tokens tracked in {@link RefreshTokenStore}.
 */
@Component
public class JwtCredentialStrategy implements CredentialStrategy {

    private static final Logger log = LoggerFactory.getLogger(JwtCredentialStrategy.class);

    private final JwtTokenService jwtTokenService;
    private final RefreshTokenStore refreshTokenStore;

    public JwtCredentialStrategy(JwtTokenService jwtTokenService, RefreshTokenStore refreshTokenStore) {
        this.jwtTokenService = jwtTokenService;
        this.refreshTokenStore = refreshTokenStore;
    }

    @Override
    public TokenMode mode() {
        return TokenMode.JWT;
    }

    @Override
    public IssuedTokens issue(UserAccount user) {
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(Claims.SUBJECT, user.getId().toString());
        if (user.getEmail() != null) {
            claims.put(JwtTokenService.CLAIM_EMAIL, user.getEmail());
        }
        String accessToken = jwtTokenService.issueAccess(claims);
        String refreshToken = jwtTokenService.issueRefresh(claims);
        refreshTokenStore.create(user, refreshToken);
        return new IssuedTokens(accessToken, refreshToken);
    }

    @Override
    public UUID resolveRefreshOwner(String refreshToken) {
        Claims claims;
        try {
            claims = jwtTokenService.decode(refreshToken);
        } catch (ProblemException ex) {
            log.warn("Refresh rejected: token failed verification");
            throw new ProblemException(ProblemCode.INVALID_REFRESH_TOKEN, null, ex);
        }
        if (!isOfType(claims, TokenType.REFRESH)) {
            log.warn("Refresh rejected: wrong token type");
            throw new ProblemException(ProblemCode.INVALID_REFRESH_TOKEN);
        }
        RefreshToken record = refreshTokenStore.validate(refreshToken, TokenType.REFRESH)
                .orElseThrow(() -> {
                    log.warn("Refresh rejected: token unknown, revoked or expired");
                    return new ProblemException(ProblemCode.INVALID_REFRESH_TOKEN);
                });
        UUID subject = parseSubject(claims)
                .filter(userId -> userId.equals(record.getUserId()))
                .orElseThrow(() -> new ProblemException(ProblemCode.INVALID_REFRESH_TOKEN));
        return subject;
    }

    @Override
    public void consumeRefresh(String refreshToken) {
        if (!refreshTokenStore.consume(refreshToken, TokenType.REFRESH)) {
            log.warn("Refresh rejected: token was consumed concurrently");
            throw new ProblemException(ProblemCode.INVALID_REFRESH_TOKEN);
        }
    }

    @Override
    public UUID resolveAccessOwner(String accessToken) {
        Claims claims = jwtTokenService.decode(accessToken);
        if (!isOfType(claims, TokenType.ACCESS)) {
            throw new ProblemException(ProblemCode.TOKEN_INVALID);
        }
        return parseSubject(claims)
                .orElseThrow(() -> new ProblemException(ProblemCode.TOKEN_INVALID));
    }

    @Override
    public boolean revoke(String token) {
        return refreshTokenStore.revoke(token);
    }

    private boolean isOfType(Claims claims, TokenType expected) {
        return TokenType.fromClaim(claims.get(JwtTokenService.CLAIM_TYPE))
                .filter(expected::equals)
                .isPresent();
    }

    private Optional<UUID> parseSubject(Claims claims) {
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(subject));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
