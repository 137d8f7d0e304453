package com.weblarek.backend.auth.token.domain;

/**
 * RefreshToken 폐기(Revoke) 사유
 *
 * ROTATED: 정상 로테이션으로 소비됨. 이 상태의 토큰이 다시 오면 재사용(replay)으로 간주한다.
 * LOGOUT: 사용자가 로그아웃으로 세션을 종료
 * ADMIN: 관리자가 사용자 세션을 강제 종료
 * REUSE_DETECTED: 재사용 감지 정책(revoke-all-on-reuse)에 의해 함께 끊긴 세션
 */
public enum RefreshRevokeReason { ROTATED, LOGOUT, ADMIN, REUSE_DETECTED }
