package com.rollcall.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.rollcall.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("select us from UserSession us join fetch us.user where us.refreshTokenHash = :refreshTokenHash")
    Optional<UserSession> findByRefreshTokenHash(@Param("refreshTokenHash") String refreshTokenHash);

    @Modifying
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.refreshTokenHash = :refreshTokenHash
               and us.revokedAt is null
            """)
    int revokeByRefreshTokenHash(@Param("refreshTokenHash") String refreshTokenHash,
                                 @Param("revokedAt") OffsetDateTime revokedAt,
                                 @Param("reason") String reason);

    @Modifying
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
               and us.expiresAt <= :now
            """)
    int revokeExpiredSessions(@Param("userId") UUID userId,
                              @Param("now") OffsetDateTime now,
                              @Param("reason") String reason);

    @Modifying
    @Query("""
            update UserSession us
               set us.revokedAt = :now,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
            """)
    int revokeAllForUser(@Param("userId") UUID userId,
                         @Param("now") OffsetDateTime now,
                         @Param("reason") String reason);
}
