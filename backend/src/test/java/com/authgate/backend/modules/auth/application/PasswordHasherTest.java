package com.authgate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class PasswordHasherTest {

    private final PasswordHasher passwordHasher = new PasswordHasher(new BCryptPasswordEncoder(4));

    @Test
    void samePasswordHashesToDifferentDigests() {
        String first = passwordHasher.hash("secret1");
        String second = passwordHasher.hash("secret1");

        assertThat(first).isNotEqualTo(second).doesNotContain("secret1");
        assertThat(passwordHasher.verify("secret1", first)).isTrue();
        assertThat(passwordHasher.verify("secret1", second)).isTrue();
    }

    @Test
    void wrongPasswordDoesNotVerify() {
        String digest = passwordHasher.hash("secret1");

        assertThat(passwordHasher.verify("secret2", digest)).isFalse();
    }

    @Test
    void missingOrMalformedInputNeverThrows() {
        String digest = passwordHasher.hash("secret1");

        assertThat(passwordHasher.verify(null, digest)).isFalse();
        assertThat(passwordHasher.verify("secret1", null)).isFalse();
        assertThat(passwordHasher.verify("secret1", "")).isFalse();
        assertThat(passwordHasher.verify("secret1", "not-a-bcrypt-digest")).isFalse();
    }

    @Test
    void passwordSharingTheFirst72BytesDoesNotVerify() {
        String prefix = "a".repeat(PasswordHasher.MAX_PASSWORD_BYTES);
        String digest = passwordHasher.hash(prefix);

        assertThat(passwordHasher.verify(prefix, digest)).isTrue();
        assertThat(passwordHasher.verify(prefix + "WRONG", digest)).isFalse();
    }

    @Test
    void hashRejectsPasswordsBeyondBcryptInputLimit() {
        // two UTF-8 bytes per character
        String atLimit = "\u00e9".repeat(36);

        assertThat(passwordHasher.verify(atLimit, passwordHasher.hash(atLimit))).isTrue();
        assertThatThrownBy(() -> passwordHasher.hash(atLimit + "x")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> passwordHasher.hash("a".repeat(72) + "correct-suffix"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void hashRejectsNull() {
        assertThatThrownBy(() -> passwordHasher.hash(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
