package com.authgate.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

import javax.crypto.SecretKey;

import com.authgate.backend.global.config.AuthProperties;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.MacAlgorithm;
import io.jsonwebtoken.security.SecureDigestAlgorithm;

import org.springframework.stereotype.Component;

/**
 * Shared HMAC secret and the fixed algorithm every token is signed with.
 * Built once from {@link AuthProperties} and never changed afterwards.
 */
@Component
public class JwtSigningKey {

    public static final List<String> SUPPORTED_ALGORITHMS = List.of("HS256", "HS384", "HS512");

    private final SecretKey secretKey;
    private final MacAlgorithm algorithm;

    public JwtSigningKey(AuthProperties properties) {
        this(properties.jwt().secret(), properties.jwt().algorithm());
    }

    public JwtSigningKey(String secret, String algorithmId) {
        this.algorithm = resolve(algorithmId);
        byte[] keyBytes = decodeSecret(secret);
        if (keyBytes.length * Byte.SIZE < algorithm.getKeyBitLength()) {
            throw new IllegalStateException("JWT secret is too short for " + algorithm.getId()
                    + ": need " + algorithm.getKeyBitLength() + " bits");
        }
        this.secretKey = Keys.hmacShaKeyFor(keyBytes);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    public MacAlgorithm getAlgorithm() {
        return algorithm;
    }

    /**
     * Accepts a base64 encoded secret and falls back to the raw UTF-8 bytes otherwise.
     */
    public static byte[] decodeSecret(String secret) {
        if (secret == null) {
            return new byte[0];
        }
        try {
            return Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
    }

    public static boolean isSupportedAlgorithm(String algorithmId) {
        return algorithmId != null && SUPPORTED_ALGORITHMS.contains(algorithmId.toUpperCase(Locale.ROOT));
    }

    public static int requiredKeyBits(String algorithmId) {
        return resolve(algorithmId).getKeyBitLength();
    }

    private static MacAlgorithm resolve(String algorithmId) {
        if (!isSupportedAlgorithm(algorithmId)) {
            throw new IllegalStateException("Unsupported JWT algorithm: " + algorithmId);
        }
        SecureDigestAlgorithm<?, ?> candidate = Jwts.SIG.get().forKey(algorithmId.toUpperCase(Locale.ROOT));
        return (MacAlgorithm) candidate;
    }
}
