package com.authgate.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.authgate.backend.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "opaque_token")
public class OpaqueToken extends AbstractCreatedEntity implements StoredToken {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private UserAccount user;

    @Column(name = "user_id", nullable = false, insertable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "token", nullable = false, unique = true, length = 255)
    private String token;

    @Enumerated(EnumType.STRING)
    @Column(name = "token_type", nullable = false, length = 16)
    private TokenType tokenType;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "is_revoked", nullable = false)
    private boolean revoked;

    @Column(name = "last_used_at")
    private OffsetDateTime lastUsedAt;

    protected OpaqueToken() {
    }

    public OpaqueToken(UserAccount user, String token, TokenType tokenType, OffsetDateTime expiresAt) {
        this.user = user;
        this.userId = user.getId();
        this.token = token;
        this.tokenType = tokenType;
        this.expiresAt = expiresAt;
    }

    public UUID getId() {
        return id;
    }

    public UserAccount getUser() {
        return user;
    }

    @Override
    public UUID getUserId() {
        return userId;
    }

    @Override
    public String getToken() {
        return token;
    }

    @Override
    public TokenType getTokenType() {
        return tokenType;
    }

    @Override
    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    @Override
    public boolean isRevoked() {
        return revoked;
    }

    public OffsetDateTime getLastUsedAt() {
        return lastUsedAt;
    }
}
