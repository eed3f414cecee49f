package com.authgate.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * One-way password digests. Every call to {@link #hash(String)} uses a fresh salt, so equal
 * passwords never produce equal digests.
 * <p>
 * BCrypt only reads the first {@value #MAX_PASSWORD_BYTES} bytes of its input, so longer
 * passwords are refused on hashing and never match on verification.
 */
@Component
public class PasswordHasher {

    public static final int MAX_PASSWORD_BYTES = 72;

    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

    private final PasswordEncoder passwordEncoder;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String rawPassword) {
        if (rawPassword == null) {
            throw new IllegalArgumentException("password must not be null");
        }
        if (exceedsMaxLength(rawPassword)) {
            throw new IllegalArgumentException("password must not exceed " + MAX_PASSWORD_BYTES + " bytes");
        }
        return passwordEncoder.encode(rawPassword);
    }

    /**
     * Never throws: a null password or an empty/foreign digest simply does not match.
     */
    public boolean verify(String rawPassword, String digest) {
        if (rawPassword == null || digest == null || digest.isBlank()) {
            return false;
        }
        if (exceedsMaxLength(rawPassword)) {
            return false;
        }
        try {
            return passwordEncoder.matches(rawPassword, digest);
        } catch (IllegalArgumentException ex) {
            log.warn("Stored password digest could not be parsed: {}", ex.getMessage());
            return false;
        }
    }

    public static boolean exceedsMaxLength(String rawPassword) {
        return rawPassword.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
