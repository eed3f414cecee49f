package com.authgate.backend.modules.auth.application;

import com.authgate.backend.global.config.AuthProperties;
import com.authgate.backend.global.error.ProblemCode;
import com.authgate.backend.global.error.ProblemException;

import org.springframework.stereotype.Component;

@Component
public class PasswordPolicy {

    private final int minLength;

    public PasswordPolicy(AuthProperties properties) {
        this.minLength = properties.password().minLength();
    }

    public void check(String rawPassword) {
        if (rawPassword == null || rawPassword.length() < minLength) {
            throw new ProblemException(
                    ProblemCode.PASSWORD_POLICY_VIOLATION,
                    "Password must be at least " + minLength + " characters long"
            );
        }
        if (PasswordHasher.exceedsMaxLength(rawPassword)) {
            throw new ProblemException(
                    ProblemCode.PASSWORD_POLICY_VIOLATION,
                    "Password must not exceed " + PasswordHasher.MAX_PASSWORD_BYTES + " bytes"
            );
        }
    }

    public int getMinLength() {
        return minLength;
    }
}
