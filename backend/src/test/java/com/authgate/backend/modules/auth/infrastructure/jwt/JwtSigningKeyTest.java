package com.authgate.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

import org.junit.jupiter.api.Test;

class JwtSigningKeyTest {

    @Test
    void resolvesConfiguredAlgorithmCaseInsensitively() {
        JwtSigningKey key = new JwtSigningKey("0123456789-0123456789-0123456789-0123456789-0123456789-0123456789", "hs384");

        assertThat(key.getAlgorithm().getId()).isEqualTo("HS384");
        assertThat(key.getSecretKey().getEncoded()).hasSizeGreaterThanOrEqualTo(48);
    }

    @Test
    void algorithmLookupIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(JwtSigningKey.isSupportedAlgorithm("hs512")).isTrue();
            assertThat(JwtSigningKey.requiredKeyBits("hs256")).isEqualTo(256);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void shortSecretFailsFast() {
        assertThatThrownBy(() -> new JwtSigningKey("short-secret", "HS256"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("HS256");
    }

    @Test
    void unsupportedAlgorithmFailsFast() {
        assertThatThrownBy(() -> new JwtSigningKey("0123456789-0123456789-0123456789", "none"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void base64SecretsAreDecoded() {
        byte[] raw = new byte[32];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = (byte) i;
        }

        assertThat(JwtSigningKey.decodeSecret(Base64.getEncoder().encodeToString(raw))).isEqualTo(raw);
        assertThat(JwtSigningKey.decodeSecret("plain-text-secret"))
                .isEqualTo("plain-text-secret".getBytes(StandardCharsets.UTF_8));
        assertThat(JwtSigningKey.requiredKeyBits("HS512")).isEqualTo(512);
    }
}
