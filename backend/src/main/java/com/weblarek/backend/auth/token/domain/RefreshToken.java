package com.weblarek.backend.auth.token.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * refresh_tokens 테이블 매핑 엔티티 (서버가 관리하는 로그인 세션 1건)
 *
 * - Access Token(JWT)은 서버에 저장하지 않는다(Stateless).
 * - Refresh Token은 원문 대신 HMAC 해시(token_hash)만 저장하고, 상태를 DB로 통제한다.
 * - 한 사용자에 여러 row가 공존할 수 있다 (멀티 디바이스).
 *
 * 불변 조건:
 * 1) raw(원문)는 DB에 절대 저장하지 않는다.
 * 2) 상태 전이(소비/폐기)는 엔티티 setter가 아니라 RefreshTokenRepository의
 *    조건부 UPDATE(... where revoked_at is null)로만 일어난다. 두 요청이 동시에 와도 하나만 이긴다.
 * 3) 한 번 revoked_at이 찍힌 row는 다시 ACTIVE가 되지 않는다.
 */
@Getter
@Entity
@Table(
    name = "refresh_tokens",
    indexes = {
        @Index(name = "uq_refresh_token_hash", columnList = "token_hash", unique = true),
        @Index(name = "idx_refresh_user_id", columnList = "user_id")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RefreshToken {

    // ---- constants (DB 제약과 반드시 맞춰야 함) ----
    public static final int TOKEN_HASH_LEN = 64;      // hmac-sha256 hex
    public static final int USER_AGENT_MAX = 255;
    public static final int IP_ADDRESS_MAX = 45;

    private static final String HEX64_REGEX = "^[0-9a-f]{64}$";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "token_hash", nullable = false, length = TOKEN_HASH_LEN, columnDefinition = "char(64)")
    private String tokenHash;

    @Column(name = "remember_me", nullable = false)
    private boolean rememberMe;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    // ---- ops / security telemetry ----
    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "revoke_reason", length = 50)
    private RefreshRevokeReason revokeReason;

    @Column(name = "user_agent", length = USER_AGENT_MAX)
    private String userAgent;

    @Column(name = "ip_address", length = IP_ADDRESS_MAX)
    private String ipAddress;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;



    // ========= factory =========

    // 발급 (referenced by TokenIssuer)
    public static RefreshToken issue(
            Long userId,
            String tokenHash,
            boolean rememberMe,
            LocalDateTime now,
            LocalDateTime expiresAt,
            String userAgent,
            String ipAddress
    ) {
        require(userId != null, "userId must not be null");
        require(now != null, "now must not be null");
        require(expiresAt != null, "expiresAt must not be null");
        require(expiresAt.isAfter(now), "expiresAt must be after now");

        RefreshToken rt = new RefreshToken();
        rt.userId = userId;
        rt.tokenHash = requireTokenHash(tokenHash);
        rt.rememberMe = rememberMe;
        rt.createdAt = now;
        rt.expiresAt = expiresAt;
        rt.userAgent = trimToNullAndMax(userAgent, USER_AGENT_MAX);
        rt.ipAddress = trimToNullAndMax(ipAddress, IP_ADDRESS_MAX);
        return rt;
    }



    // ========= domain =========

    /**
     * 현재 시각 기준 상태.
     * revoke가 만료보다 우선한다: 이미 소비된 토큰은 만료 후에 와도 CONSUMED(재사용 신호)로 본다.
     */
    public RefreshTokenState stateAt(LocalDateTime now) {
        Objects.requireNonNull(now, "now must not be null");

        if (isRotated()) return RefreshTokenState.CONSUMED;
        if (isRevoked()) return RefreshTokenState.REVOKED;
        if (isExpired(now)) return RefreshTokenState.EXPIRED;
        return RefreshTokenState.ACTIVE;
    }

    public boolean isExpired(LocalDateTime now) {
        Objects.requireNonNull(now, "now must not be null");
        return !expiresAt.isAfter(now);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isRotated() {
        return revokeReason == RefreshRevokeReason.ROTATED;
    }



    // ========= helpers =========
    private static String requireTokenHash(String tokenHash) {
        require(tokenHash != null, "tokenHash must not be null");
        String h = tokenHash.trim();
        require(h.matches(HEX64_REGEX), "tokenHash must be lowercase hex(64)");
        return h;
    }

    private static String trimToNullAndMax(String v, int max) {
        if (v == null) return null;
        String t = v.trim();
        if (t.isEmpty()) return null;
        return t.length() <= max ? t : t.substring(0, max);
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
