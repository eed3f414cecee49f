package com.authgate.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.authgate.backend.modules.auth.domain.OpaqueToken;
import com.authgate.backend.modules.auth.domain.TokenType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OpaqueTokenRepository extends JpaRepository<OpaqueToken, UUID> {

    @Query("select ot from OpaqueToken ot where ot.token = :token and ot.revoked = false")
    Optional<OpaqueToken> findActiveByToken(@Param("token") String token);

    @Query("""
            select ot
              from OpaqueToken ot
             where ot.token = :token
               and ot.tokenType = :tokenType
               and ot.revoked = false
            """)
    Optional<OpaqueToken> findActiveByTokenAndType(@Param("token") String token, @Param("tokenType") TokenType tokenType);

    @Modifying(flushAutomatically = true)
    @Query("update OpaqueToken ot set ot.lastUsedAt = :usedAt where ot.id = :id")
    int touchLastUsed(@Param("id") UUID id, @Param("usedAt") OffsetDateTime usedAt);

    @Modifying(flushAutomatically = true)
    @Query("update OpaqueToken ot set ot.revoked = true where ot.token = :token")
    int revokeByToken(@Param("token") String token);

    @Modifying(flushAutomatically = true)
    @Query("""
            update OpaqueToken ot
               set ot.revoked = true
             where ot.token = :token
               and ot.tokenType = :tokenType
               and ot.revoked = false
            """)
    int consumeByToken(@Param("token") String token, @Param("tokenType") TokenType tokenType);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update OpaqueToken ot set ot.revoked = true where ot.userId = :userId and ot.revoked = false")
    int revokeAllByUserId(@Param("userId") UUID userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update OpaqueToken ot
               set ot.revoked = true
             where ot.userId = :userId
               and ot.tokenType = :tokenType
               and ot.revoked = false
            """)
    int revokeAllByUserIdAndType(@Param("userId") UUID userId, @Param("tokenType") TokenType tokenType);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from OpaqueToken ot where ot.expiresAt < :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}
