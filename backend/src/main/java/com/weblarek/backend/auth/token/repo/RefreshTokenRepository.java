package com.weblarek.backend.auth.token.repo;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.weblarek.backend.auth.token.domain.RefreshRevokeReason;
import com.weblarek.backend.auth.token.domain.RefreshToken;

/**
 * refresh_tokens 저장소
 *
 * 상태 전이는 전부 "단일 조건부 UPDATE" 로 한다. (read -> modify -> write 금지)
 * - where ... and r.revokedAt is null 이 원자적 check-and-remove 역할을 한다.
 * - 반환값(영향받은 row 수)이 0이면 이미 누군가 먼저 소비/폐기한 것이다.
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    List<RefreshToken> findAllByUserId(Long userId);

    /**
     * 로테이션용 소비. 동시에 두 rotate가 같은 row를 노려도 DB row lock 때문에 직렬화되고,
     * 뒤에 온 쪽은 조건(revoked_at is null)을 다시 평가해 0을 받는다.
     */
    @Modifying
    @Query("""
            update RefreshToken r
               set r.revokedAt = :now,
                   r.revokeReason = com.weblarek.backend.auth.token.domain.RefreshRevokeReason.ROTATED,
                   r.lastUsedAt = :now
             where r.id = :id
               and r.revokedAt is null
            """)
    int consumeIfActive(@Param("id") Long id, @Param("now") LocalDateTime now);

    // 로그아웃용 단건 폐기 (멱등: 이미 폐기/미존재면 0)
    @Modifying
    @Query("""
            update RefreshToken r
               set r.revokedAt = :now,
                   r.revokeReason = :reason,
                   r.lastUsedAt = :now
             where r.tokenHash = :tokenHash
               and r.revokedAt is null
            """)
    int revokeIfActive(@Param("tokenHash") String tokenHash,
                       @Param("reason") RefreshRevokeReason reason,
                       @Param("now") LocalDateTime now);

    // 사용자 전체 세션 폐기 (관리자 강제 종료 / 재사용 감지)
    @Modifying
    @Query("""
            update RefreshToken r
               set r.revokedAt = :now,
                   r.revokeReason = :reason
             where r.userId = :userId
               and r.revokedAt is null
            """)
    int revokeAllActiveByUserId(@Param("userId") Long userId,
                                @Param("reason") RefreshRevokeReason reason,
                                @Param("now") LocalDateTime now);
}
