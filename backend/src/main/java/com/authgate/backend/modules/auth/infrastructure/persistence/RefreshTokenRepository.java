package com.authgate.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.authgate.backend.modules.auth.domain.RefreshToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RefreshTokenRepository extends JpaRepository<RefreshToken, UUID> {

    @Query("select rt from RefreshToken rt where rt.token = :token and rt.revoked = false")
    Optional<RefreshToken> findActiveByToken(@Param("token") String token);

    /**
     * Flips the row whether or not it was already revoked; the count reports existence.
     */
    @Modifying(flushAutomatically = true)
    @Query("update RefreshToken rt set rt.revoked = true where rt.token = :token")
    int revokeByToken(@Param("token") String token);

    /**
     * Conditional flip used for rotation. Only one concurrent caller can observe 1.
     */
    @Modifying(flushAutomatically = true)
    @Query("update RefreshToken rt set rt.revoked = true where rt.token = :token and rt.revoked = false")
    int consumeByToken(@Param("token") String token);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update RefreshToken rt set rt.revoked = true where rt.userId = :userId and rt.revoked = false")
    int revokeAllByUserId(@Param("userId") UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RefreshToken rt where rt.expiresAt < :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
