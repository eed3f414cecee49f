package com.authgate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Map;

import com.authgate.backend.global.config.AuthProperties;
import com.authgate.backend.global.error.ProblemCode;
import com.authgate.backend.global.error.ProblemException;
import com.authgate.backend.modules.auth.infrastructure.jwt.JwtSigningKey;
import com.authgate.backend.support.TestAuthProperties;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Map<String, Object> CLAIMS = Map.of("sub", "5b1f7c7e-1111-4a6e-9d0f-3a2b1c0d9e8f", "email", "a@x.io");

    private final AuthProperties properties = TestAuthProperties.defaults();
    private final JwtTokenService service = serviceAt(NOW, properties);

    @Test
    void accessTokenCarriesClaimsTypeAndExpiry() {
        Claims claims = service.decode(service.issueAccess(CLAIMS));

        assertThat(claims.getSubject()).isEqualTo(CLAIMS.get("sub"));
        assertThat(claims.get(JwtTokenService.CLAIM_EMAIL)).isEqualTo("a@x.io");
        assertThat(claims.get(JwtTokenService.CLAIM_TYPE)).isEqualTo("access");
        assertThat(claims.getIssuedAt()).isEqualTo(Date.from(NOW));
        assertThat(claims.getExpiration()).isEqualTo(Date.from(NOW.plus(Duration.ofMinutes(30))));
        assertThat(claims.getId()).isNotBlank();
    }

    @Test
    void refreshTokenUsesRefreshLifetime() {
        Claims claims = service.decode(service.issueRefresh(CLAIMS));

        assertThat(claims.get(JwtTokenService.CLAIM_TYPE)).isEqualTo("refresh");
        assertThat(claims.getExpiration()).isEqualTo(Date.from(NOW.plus(Duration.ofDays(7))));
    }

    @Test
    void tokensMintedInTheSameInstantDiffer() {
        assertThat(service.issueRefresh(CLAIMS)).isNotEqualTo(service.issueRefresh(CLAIMS));
    }

    @Test
    void explicitTtlOverridesDefault() {
        Claims claims = service.decode(service.issueAccess(CLAIMS, Duration.ofMinutes(1)));

        assertThat(claims.getExpiration()).isEqualTo(Date.from(NOW.plus(Duration.ofMinutes(1))));
    }

    @Test
    void expiredTokenIsRejected() {
        String token = service.issueAccess(CLAIMS);
        JwtTokenService later = serviceAt(NOW.plus(Duration.ofMinutes(31)), properties);

        assertInvalid(() -> later.decode(token));
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        AuthProperties foreign = TestAuthProperties.with(
                "another-signing-secret-with-more-than-thirty-two-bytes",
                "HS256",
                Duration.ofMinutes(30),
                Duration.ofDays(7)
        );
        String token = serviceAt(NOW, foreign).issueAccess(CLAIMS);

        assertInvalid(() -> service.decode(token));
    }

    @Test
    void tokenSignedWithAnotherAlgorithmIsRejected() {
        AuthProperties hs512 = TestAuthProperties.with(
                TestAuthProperties.SECRET, "HS512", Duration.ofMinutes(30), Duration.ofDays(7));
        String token = serviceAt(NOW, hs512).issueAccess(CLAIMS);

        assertInvalid(() -> service.decode(token));
    }

    @Test
    void tokenWithoutExpiryIsRejected() {
        JwtSigningKey key = new JwtSigningKey(properties);
        String token = Jwts.builder()
                .claims(CLAIMS)
                .issuedAt(Date.from(NOW))
                .signWith(key.getSecretKey(), key.getAlgorithm())
                .compact();

        assertInvalid(() -> service.decode(token));
    }

    @Test
    void malformedAndTamperedTokensAreRejected() {
        String token = service.issueAccess(CLAIMS);
        String tampered = token.substring(0, token.length() - 2)
                + (token.endsWith("AA") ? "BB" : "AA");

        assertInvalid(() -> service.decode("not.a.jwt"));
        assertInvalid(() -> service.decode(""));
        assertInvalid(() -> service.decode(tampered));
    }

    private static void assertInvalid(org.assertj.core.api.ThrowableAssert.ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getProblemCode())
                .isEqualTo(ProblemCode.TOKEN_INVALID);
    }

    private static JwtTokenService serviceAt(Instant instant, AuthProperties properties) {
        return new JwtTokenService(
                new JwtSigningKey(properties),
                properties,
                Clock.fixed(instant, ZoneOffset.UTC)
        );
    }
}
