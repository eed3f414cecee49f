package com.authgate.backend.global.config;

import java.util.ArrayList;
import java.util.List;

import com.authgate.backend.modules.auth.infrastructure.jwt.JwtSigningKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Startup check for settings that bean validation alone cannot express.
 * Any violation aborts the application.
 */
@Component
public class AuthSettingsValidator {

    static final String PLACEHOLDER_SECRET = "change-me-dev-secret-do-not-use-in-production";

    private static final Logger log = LoggerFactory.getLogger(AuthSettingsValidator.class);

    private final AuthProperties properties;

    public AuthSettingsValidator(AuthProperties properties) {
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateOnStartup() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid auth setting: {}", problem));
            throw new IllegalStateException("Invalid auth settings: " + String.join("; ", problems));
        }
        log.info("Auth settings validated (algorithm={}, accessTtl={}, refreshTtl={})",
                properties.jwt().algorithm(),
                properties.token().accessTtl(),
                properties.token().refreshTtl());
    }

    public List<String> validate() {
        List<String> problems = new ArrayList<>();

        String secret = properties.jwt().secret();
        if (PLACEHOLDER_SECRET.equals(secret)) {
            problems.add("auth.jwt.secret: replace the placeholder with a random secret");
        }

        String algorithm = properties.jwt().algorithm();
        if (!JwtSigningKey.isSupportedAlgorithm(algorithm)) {
            problems.add("auth.jwt.algorithm: " + algorithm + " is not one of " + JwtSigningKey.SUPPORTED_ALGORITHMS);
        } else {
            int requiredBits = JwtSigningKey.requiredKeyBits(algorithm);
            int actualBits = JwtSigningKey.decodeSecret(secret).length * Byte.SIZE;
            if (actualBits < requiredBits) {
                problems.add("auth.jwt.secret: " + algorithm + " needs at least " + requiredBits
                        + " bits, got " + actualBits);
            }
        }

        AuthProperties.Token token = properties.token();
        if (token.accessTtl().isNegative() || token.accessTtl().isZero()) {
            problems.add("auth.token.access-ttl: must be positive");
        }
        if (token.refreshTtl().compareTo(token.accessTtl()) <= 0) {
            problems.add("auth.token.refresh-ttl: must be longer than access-ttl");
        }
        return problems;
    }
}
