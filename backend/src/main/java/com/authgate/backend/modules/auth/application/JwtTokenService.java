package com.authgate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

import com.authgate.backend.global.config.AuthProperties;
import com.authgate.backend.global.error.ProblemCode;
import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.auth.domain.TokenType;
import com.authgate.backend.modules.auth.infrastructure.jwt.JwtSigningKey;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;

import org.springframework.stereotype.Service;

/**
 * Mints and verifies signed, self-contained bearer tokens.
 * <p>
 * {@link #decode(String)} only proves that this service minted the token and that it has not
 * expired. Callers still have to re-read the subject from the user store.
 */
@Service
public class JwtTokenService {

    public static final String CLAIM_TYPE = "type";
    public static final String CLAIM_EMAIL = "email";

    private final JwtSigningKey signingKey;
    private final JwtParser parser;
    private final Duration accessTtl;
    private final Duration refreshTtl;
    private final Clock clock;

    public JwtTokenService(JwtSigningKey signingKey, AuthProperties properties, Clock clock) {
        this.signingKey = signingKey;
        this.accessTtl = properties.token().accessTtl();
        this.refreshTtl = properties.token().refreshTtl();
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(signingKey.getSecretKey())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    public String issueAccess(Map<String, ?> claims) {
        return issueAccess(claims, accessTtl);
    }

    public String issueAccess(Map<String, ?> claims, Duration ttl) {
        return issue(claims, TokenType.ACCESS, ttl);
    }

    public String issueRefresh(Map<String, ?> claims) {
        return issue(claims, TokenType.REFRESH, refreshTtl);
    }

    /**
     * @throws ProblemException {@link ProblemCode#TOKEN_INVALID} for a bad signature, a malformed
     *                          token, a foreign algorithm or a missing/past {@code exp}
     */
    public Claims decode(String token) {
        Jws<Claims> jws;
        try {
            jws = parser.parseSignedClaims(token);
        } catch (JwtException | IllegalArgumentException ex) {
            throw new ProblemException(ProblemCode.TOKEN_INVALID, null, ex);
        }
        if (!signingKey.getAlgorithm().getId().equals(jws.getHeader().getAlgorithm())) {
            throw new ProblemException(ProblemCode.TOKEN_INVALID);
        }
        Claims claims = jws.getPayload();
        if (claims.getExpiration() == null) {
            throw new ProblemException(ProblemCode.TOKEN_INVALID);
        }
        return claims;
    }

    public Duration getAccessTtl() {
        return accessTtl;
    }

    public Duration getRefreshTtl() {
        return refreshTtl;
    }

    private String issue(Map<String, ?> claims, TokenType type, Duration ttl) {
        Instant now = clock.instant();
        return Jwts.builder()
                .claims(claims)
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .claim(CLAIM_TYPE, type.claimValue())
                .signWith(signingKey.getSecretKey(), signingKey.getAlgorithm())
                .compact();
    }
}
