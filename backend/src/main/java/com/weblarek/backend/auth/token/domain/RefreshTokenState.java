package com.weblarek.backend.auth.token.domain;

/**
 * refresh 토큰 한 건의 상태. ACTIVE에서만 나갈 수 있고 나머지는 전부 종착 상태다.
 *
 *   ACTIVE -> CONSUMED (로테이션, 새 토큰 발급)
 *   ACTIVE -> REVOKED  (로그아웃 / 관리자 / 재사용 감지)
 *   ACTIVE -> EXPIRED  (TTL 경과)
 */
public enum RefreshTokenState {
    ACTIVE, CONSUMED, REVOKED, EXPIRED
}
